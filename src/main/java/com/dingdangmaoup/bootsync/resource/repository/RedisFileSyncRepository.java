package com.dingdangmaoup.bootsync.resource.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Sync records as one Redis hash per file: field = region id, value = synced bytes.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisFileSyncRepository implements FileSyncRepository {

    static final String KEY_PREFIX = "bootresourcefile:sync:";

    private final ReactiveRedisTemplate<String, String> reactiveRedisTemplate;

    @Override
    public Mono<Void> setSyncedBytes(long fileId, String regionId, long size) {
        return reactiveRedisTemplate.<String, String>opsForHash()
                .put(key(fileId), regionId, Long.toString(size))
                .doOnSuccess(v -> log.trace("Recorded {} synced bytes of file {} on {}", size, fileId, regionId))
                .then();
    }

    @Override
    public Mono<Map<String, Long>> getSyncedBytes(long fileId) {
        return reactiveRedisTemplate.<String, String>opsForHash()
                .entries(key(fileId))
                .collect(HashMap::new, (map, entry) -> map.put(entry.getKey(), Long.parseLong(entry.getValue())));
    }

    @Override
    public Mono<Void> deleteFile(long fileId) {
        return reactiveRedisTemplate.delete(key(fileId)).then();
    }

    static String key(long fileId) {
        return KEY_PREFIX + fileId;
    }
}
