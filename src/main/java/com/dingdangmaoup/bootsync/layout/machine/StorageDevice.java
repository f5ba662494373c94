package com.dingdangmaoup.bootsync.layout.machine;

/**
 * Anything a filesystem can be put on: a block device or a partition
 */
public interface StorageDevice {

    String getName();

    long getSize();

    /**
     * @return the filesystem on this device, {@code null} if it is unformatted
     */
    Filesystem getFilesystem();

    void setFilesystem(Filesystem filesystem);
}
