package com.dingdangmaoup.bootsync.simplestreams;

import lombok.Builder;
import lombok.Value;

/**
 * Identifies one boot image variant
 */
@Value
@Builder(toBuilder = true)
public class ImageSpec {

    String os;
    String arch;
    String subarch;
    String kflavor;
    String release;
    String label;

    public static ImageSpec of(String os, String arch, String subarch, String kflavor, String release, String label) {
        return new ImageSpec(os, arch, subarch, kflavor, release, label);
    }
}
