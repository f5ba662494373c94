package com.dingdangmaoup.bootsync.sync;

import lombok.Value;

/**
 * A stored file to remove from the image storage
 */
@Value(staticConstructor = "of")
public class ResourceIdentifier {
    String sha256;
    String filenameOnDisk;
}
