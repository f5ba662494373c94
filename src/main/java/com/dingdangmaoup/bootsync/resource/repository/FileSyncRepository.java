package com.dingdangmaoup.bootsync.resource.repository;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Bytes of each boot resource file held by each region controller
 */
public interface FileSyncRepository {

    /**
     * Record how many bytes of the file {@code regionId} holds. Callers report
     * {@code min(local size, file size)}.
     */
    Mono<Void> setSyncedBytes(long fileId, String regionId, long size);

    /**
     * @return region id to synced bytes, empty map when nothing was reported
     */
    Mono<Map<String, Long>> getSyncedBytes(long fileId);

    Mono<Void> deleteFile(long fileId);
}
