package com.dingdangmaoup.bootsync.lifecycle;

import com.dingdangmaoup.bootsync.config.properties.StorageProperties;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Readiness of this region: Redis reachable and enough free space in the image storage.
 * Reported through Actuator's health endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadinessProbe implements ReactiveHealthIndicator {

    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(2);

    private final ReactiveRedisTemplate<String, String> reactiveRedisTemplate;
    private final ImageStorage imageStorage;
    private final StorageProperties storageProperties;

    private volatile boolean draining = false;

    @Override
    public Mono<Health> health() {
        return readiness()
                .map(response -> {
                    if ("UP".equals(response.get("status"))) {
                        return Health.up().withDetails(response).build();
                    }
                    return Health.down().withDetails(response).build();
                })
                .onErrorResume(error -> {
                    log.error("Health check error", error);
                    return Mono.just(Health.down().withException(error).build());
                });
    }

    public Mono<Map<String, Object>> readiness() {
        if (draining) {
            Map<String, Object> response = new HashMap<>();
            response.put("status", "DOWN");
            response.put("reason", "draining");
            return Mono.just(response);
        }

        Mono<Boolean> redisCheck = reactiveRedisTemplate.execute(connection -> connection.ping())
                .next()
                .map("PONG"::equals)
                .timeout(CHECK_TIMEOUT)
                .onErrorReturn(false);

        long minFreeSpace = storageProperties.getMinFreeSpace().toBytes();
        Mono<Long> availableSpace = imageStorage.getAvailableSpace()
                .timeout(CHECK_TIMEOUT)
                .onErrorReturn(-1L);

        return Mono.zip(redisCheck, availableSpace)
                .map(tuple -> {
                    boolean redisHealthy = tuple.getT1();
                    long available = tuple.getT2();
                    boolean storageHealthy = available >= minFreeSpace;

                    Map<String, Object> response = new HashMap<>();
                    response.put("status", redisHealthy && storageHealthy ? "UP" : "DOWN");
                    response.put("redis", redisHealthy ? "connected" : "disconnected");
                    if (available < 0) {
                        response.put("storage", "unavailable");
                    } else {
                        response.put("storage", storageHealthy ? "available" : "insufficient space");
                        response.put("availableBytes", available);
                    }
                    return response;
                })
                .onErrorResume(error -> {
                    log.error("Readiness check error", error);
                    Map<String, Object> response = new HashMap<>();
                    response.put("status", "DOWN");
                    response.put("error", String.valueOf(error.getMessage()));
                    return Mono.just(response);
                });
    }

    public boolean isDraining() {
        return draining;
    }

    public void setDraining(boolean draining) {
        this.draining = draining;
        log.info("Readiness probe draining status set to: {}", draining);
    }
}
