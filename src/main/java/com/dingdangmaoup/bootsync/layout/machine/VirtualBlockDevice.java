package com.dingdangmaoup.bootsync.layout.machine;

import lombok.Getter;

/**
 * Block device backed by a filesystem group: a RAID array, a logical volume or a
 * bcache device
 */
@Getter
public class VirtualBlockDevice extends BlockDevice {

    private final FilesystemGroup filesystemGroup;

    public VirtualBlockDevice(String name, long size, FilesystemGroup filesystemGroup) {
        super(name, size);
        this.filesystemGroup = filesystemGroup;
    }
}
