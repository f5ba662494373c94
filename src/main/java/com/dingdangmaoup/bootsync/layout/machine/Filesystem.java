package com.dingdangmaoup.bootsync.layout.machine;

import com.dingdangmaoup.bootsync.layout.FilesystemType;
import lombok.Builder;
import lombok.Value;

/**
 * A filesystem on a device, or a marker that the device belongs to a RAID array,
 * volume group or bcache device. Special filesystems have no device.
 */
@Value
@Builder
public class Filesystem {
    FilesystemType fstype;
    String mountPoint;
    String mountOptions;
    FilesystemGroup filesystemGroup;
    CacheSet cacheSet;

    public static Filesystem member(FilesystemType fstype, FilesystemGroup group) {
        return Filesystem.builder().fstype(fstype).filesystemGroup(group).build();
    }
}
