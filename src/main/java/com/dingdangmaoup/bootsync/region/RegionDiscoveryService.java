package com.dingdangmaoup.bootsync.region;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Registry of the region controllers sharing the image storage duty
 */
public interface RegionDiscoveryService {

    /**
     * Id of the region this process runs as
     */
    String currentRegionId();

    /**
     * Register current region
     */
    Mono<Void> registerSelf();

    /**
     * Deregister current region
     */
    Mono<Void> deregister();

    /**
     * Send heartbeat
     */
    Mono<Void> heartbeat();

    /**
     * All live regions, this one included
     */
    Flux<RegionInfo> discoverRegions();

    /**
     * Number of live regions; every file must reach each of them
     */
    Mono<Long> countRegions();

    /**
     * Get specific region by ID
     */
    Mono<RegionInfo> getRegion(String regionId);

    /**
     * Mark region as draining
     */
    Mono<Void> markDraining();
}
