package com.dingdangmaoup.bootsync.region;

import com.dingdangmaoup.bootsync.config.properties.RegionProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;

/**
 * Redis-based region registry
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisRegionDiscovery implements RegionDiscoveryService {

    static final String ACTIVE_REGIONS_KEY = "regions:active";
    static final String REGION_KEY_PREFIX = "region:";

    private static final long MAX_REGISTRATION_ATTEMPTS = 6;
    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(5);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(10);

    private final ReactiveRedisTemplate<String, String> reactiveRedisTemplate;
    private final ObjectMapper objectMapper;
    private final RegionProperties regionProperties;

    private volatile RegionInfo.RegionStatus currentStatus = RegionInfo.RegionStatus.HEALTHY;
    private final Instant startTime = Instant.now();

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        registerSelf()
                .retryWhen(Retry.backoff(MAX_REGISTRATION_ATTEMPTS, INITIAL_BACKOFF)
                        .maxBackoff(MAX_BACKOFF)
                        .doBeforeRetry(signal ->
                            log.warn("Retrying region registration, attempt: {}", signal.totalRetries() + 1)))
                .doOnSuccess(v -> log.info("Region registration successful"))
                .doOnError(e -> log.error("Failed to register region after retries", e))
                .subscribe();
    }

    @Override
    public String currentRegionId() {
        return regionProperties.getId();
    }

    @Override
    public Mono<Void> registerSelf() {
        RegionInfo regionInfo = buildRegionInfo();
        return saveRegionInfo(regionInfo)
                .then(reactiveRedisTemplate.opsForSet().add(ACTIVE_REGIONS_KEY, regionInfo.getRegionId()))
                .doOnSuccess(count -> log.info("Registered region: {}", regionInfo))
                .then();
    }

    @Override
    public Mono<Void> deregister() {
        String regionId = currentRegionId();
        return reactiveRedisTemplate.delete(REGION_KEY_PREFIX + regionId)
                .then(reactiveRedisTemplate.opsForSet().remove(ACTIVE_REGIONS_KEY, regionId))
                .doOnSuccess(count -> log.info("Deregistered region: {}", regionId))
                .then();
    }

    @Override
    public Mono<Void> heartbeat() {
        if (currentStatus == RegionInfo.RegionStatus.DRAINING) {
            log.debug("Skipping heartbeat, region is draining");
            return Mono.empty();
        }

        RegionInfo regionInfo = buildRegionInfo();
        return saveRegionInfo(regionInfo)
                .doOnSuccess(success -> log.trace("Heartbeat sent for region: {}", regionInfo.getRegionId()))
                .then();
    }

    /**
     * Scheduled heartbeat task that properly subscribes to the reactive heartbeat
     */
    @Scheduled(fixedDelayString = "${bootsync.region.heartbeat-interval:10s}")
    public void scheduledHeartbeat() {
        heartbeat()
                .doOnError(e -> log.error("Failed to send heartbeat", e))
                .subscribe();
    }

    @Override
    public Flux<RegionInfo> discoverRegions() {
        return reactiveRedisTemplate.opsForSet()
                .members(ACTIVE_REGIONS_KEY)
                .flatMap(this::getRegion);
    }

    @Override
    public Mono<Long> countRegions() {
        return discoverRegions().count();
    }

    @Override
    public Mono<RegionInfo> getRegion(String targetRegionId) {
        return reactiveRedisTemplate.opsForValue()
                .get(REGION_KEY_PREFIX + targetRegionId)
                .flatMap(json -> {
                    try {
                        RegionInfo info = objectMapper.readValue(json, RegionInfo.class);

                        // Check if region is expired
                        if (info.getLastHeartbeat().plus(regionProperties.getTimeout()).isBefore(Instant.now())) {
                            log.warn("Region {} is expired, removing from active set", targetRegionId);
                            return reactiveRedisTemplate.opsForSet()
                                    .remove(ACTIVE_REGIONS_KEY, targetRegionId)
                                    .then(Mono.empty());
                        }

                        return Mono.just(info);
                    } catch (JsonProcessingException e) {
                        log.error("Failed to deserialize region info for: {}", targetRegionId, e);
                        return Mono.empty();
                    }
                });
    }

    @Override
    public Mono<Void> markDraining() {
        currentStatus = RegionInfo.RegionStatus.DRAINING;
        RegionInfo regionInfo = buildRegionInfo();
        return saveRegionInfo(regionInfo)
                .doOnSuccess(success -> log.info("Marked region as draining: {}", regionInfo.getRegionId()))
                .then();
    }

    public boolean isDraining() {
        return currentStatus == RegionInfo.RegionStatus.DRAINING;
    }

    private RegionInfo buildRegionInfo() {
        return RegionInfo.builder()
                .regionId(regionProperties.getId())
                .host(regionProperties.getHost())
                .httpPort(regionProperties.getHttpPort())
                .status(currentStatus)
                .lastHeartbeat(Instant.now())
                .uptimeSeconds(Duration.between(startTime, Instant.now()).getSeconds())
                .build();
    }

    private Mono<Boolean> saveRegionInfo(RegionInfo regionInfo) {
        try {
            String json = objectMapper.writeValueAsString(regionInfo);
            return reactiveRedisTemplate.opsForValue()
                    .set(REGION_KEY_PREFIX + regionInfo.getRegionId(), json,
                            regionProperties.getTimeout().plusSeconds(10));
        } catch (JsonProcessingException e) {
            return Mono.error(new RuntimeException("Failed to serialize region info", e));
        }
    }
}
