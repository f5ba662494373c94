package com.dingdangmaoup.bootsync.coordination;

import com.dingdangmaoup.bootsync.config.properties.CoordinationProperties;
import com.dingdangmaoup.bootsync.config.properties.RegionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Redis-based distributed lock implementation.
 * <p>
 * Writes to one boot resource file are serialized across all regions by holding
 * {@code lock:bootresourcefile:<filename on disk>}.
 */
@Slf4j
@Component
public class DistributedLock {

    private static final String KEY_PREFIX = "lock:";

    private final ReactiveRedisTemplate<String, String> reactiveRedisTemplate;
    private final Duration lockTtl;
    private final Duration waitTimeout;
    private final Duration retryInterval;
    private final String regionId;

    public DistributedLock(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                           CoordinationProperties coordinationProperties,
                           RegionProperties regionProperties) {
        this.reactiveRedisTemplate = reactiveRedisTemplate;
        this.lockTtl = coordinationProperties.getLock().getTtl();
        this.waitTimeout = coordinationProperties.getLock().getWaitTimeout();
        this.retryInterval = coordinationProperties.getLock().getRetryInterval();
        this.regionId = regionProperties.getId();
    }

    public static String fileLockKey(String filenameOnDisk) {
        return "bootresourcefile:" + filenameOnDisk;
    }

    /**
     * Acquire a distributed lock
     */
    public Mono<Boolean> acquireLock(String lockKey, String owner) {
        String redisKey = KEY_PREFIX + lockKey;
        return reactiveRedisTemplate.opsForValue()
                .setIfAbsent(redisKey, owner, lockTtl)
                .doOnNext(acquired -> {
                    if (acquired) {
                        log.debug("Acquired lock: {} by: {}", lockKey, owner);
                    } else {
                        log.debug("Failed to acquire lock: {} (held by another owner)", lockKey);
                    }
                });
    }

    /**
     * Release a distributed lock
     */
    public Mono<Boolean> releaseLock(String lockKey, String owner) {
        String redisKey = KEY_PREFIX + lockKey;
        return reactiveRedisTemplate.opsForValue()
                .get(redisKey)
                .flatMap(current -> {
                    if (owner.equals(current)) {
                        return reactiveRedisTemplate.delete(redisKey)
                                .map(count -> count > 0)
                                .doOnNext(released -> {
                                    if (released) {
                                        log.debug("Released lock: {} by: {}", lockKey, owner);
                                    }
                                });
                    } else {
                        log.warn("Cannot release lock: {} (owned by: {}, current: {})",
                                lockKey, current, owner);
                        return Mono.just(false);
                    }
                })
                .defaultIfEmpty(false);
    }

    /**
     * Try to acquire lock, polling every retry interval until the timeout expires
     */
    public Mono<Boolean> tryAcquireLock(String lockKey, String owner, Duration timeout) {
        return acquireLock(lockKey, owner)
                .filter(Boolean::booleanValue)
                .repeatWhenEmpty(repeats -> repeats.delayElements(retryInterval))
                .timeout(timeout, Mono.just(false));
    }

    /**
     * Execute action with lock, waiting up to the configured wait timeout for it
     */
    public <T> Mono<T> withLock(String lockKey, Mono<T> action) {
        return Mono.defer(() -> {
            String owner = regionId + "/" + UUID.randomUUID();
            return tryAcquireLock(lockKey, owner, waitTimeout)
                    .flatMap(acquired -> {
                        if (!acquired) {
                            return Mono.error(new LockException("Failed to acquire lock: " + lockKey));
                        }

                        return action
                                .doFinally(signalType -> releaseLock(lockKey, owner).subscribe());
                    });
        });
    }

    public static class LockException extends RuntimeException {
        public LockException(String message) {
            super(message);
        }
    }
}
