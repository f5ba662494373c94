package com.dingdangmaoup.bootsync.layout.machine;

import lombok.Getter;

/**
 * bcache cache shared by every bcache device using the same cache device
 */
@Getter
public class CacheSet {

    private final StorageDevice cacheDevice;

    public CacheSet(StorageDevice cacheDevice) {
        this.cacheDevice = cacheDevice;
    }
}
