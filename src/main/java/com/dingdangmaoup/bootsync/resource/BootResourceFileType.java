package com.dingdangmaoup.bootsync.resource;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of files a boot resource set is made of, with their wire names
 */
public enum BootResourceFileType {

    ROOT_TGZ("root-tgz"),
    ROOT_TBZ("root-tbz"),
    ROOT_TXZ("root-txz"),
    ROOT_DD("root-dd"),
    ROOT_DDTAR("root-dd.tar"),
    ROOT_DDRAW("root-dd.raw"),
    ROOT_DDBZ2("root-dd.bz2"),
    ROOT_DDGZ("root-dd.gz"),
    ROOT_DDXZ("root-dd.xz"),
    ROOT_DDTBZ("root-dd.tar.bz2"),
    ROOT_DDTXZ("root-dd.tar.xz"),
    ROOT_DDTGZ("root-dd.tar.gz"),
    SQUASHFS_IMAGE("squashfs"),
    ROOT_IMAGE("root-image.gz"),
    BOOT_KERNEL("boot-kernel"),
    BOOT_INITRD("boot-initrd"),
    BOOT_DTB("boot-dtb"),
    BOOTLOADER("bootloader"),
    ARCHIVE_TAR_XZ("archive.tar.xz");

    /**
     * Root filesystems a machine can be deployed from
     */
    public static final Set<BootResourceFileType> ROOT_TYPES = EnumSet.of(
            SQUASHFS_IMAGE, ROOT_IMAGE, ROOT_TGZ, ROOT_TBZ, ROOT_TXZ,
            ROOT_DD, ROOT_DDTAR, ROOT_DDRAW, ROOT_DDBZ2, ROOT_DDGZ, ROOT_DDXZ,
            ROOT_DDTBZ, ROOT_DDTXZ, ROOT_DDTGZ);

    /**
     * Tarball and disk image formats written by the fast-path installer
     */
    public static final Set<BootResourceFileType> XINSTALL_TYPES = EnumSet.of(
            ROOT_TGZ, ROOT_TBZ, ROOT_TXZ,
            ROOT_DD, ROOT_DDTAR, ROOT_DDRAW, ROOT_DDBZ2, ROOT_DDGZ, ROOT_DDXZ,
            ROOT_DDTBZ, ROOT_DDTXZ, ROOT_DDTGZ);

    private final String value;

    BootResourceFileType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BootResourceFileType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown boot resource file type: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
