package com.dingdangmaoup.bootsync.lifecycle;

import com.dingdangmaoup.bootsync.region.RegionDiscoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Takes the region out of the registry before the context goes away, so peers stop
 * choosing it as a download source and stop counting it for sync completeness.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GracefulShutdownHandler implements ApplicationListener<ContextClosedEvent> {

    private static final Duration STEP_TIMEOUT = Duration.ofSeconds(5);

    private final RegionDiscoveryService regionDiscoveryService;
    private final ReadinessProbe readinessProbe;

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("=== Starting graceful shutdown of region {} ===", regionDiscoveryService.currentRegionId());

        try {
            log.info("Step 1: Marking readiness probe as draining");
            readinessProbe.setDraining(true);

            log.info("Step 2: Marking region as draining in discovery service");
            regionDiscoveryService.markDraining()
                    .block(STEP_TIMEOUT);

            log.info("Step 3: Deregistering region from discovery service");
            regionDiscoveryService.deregister()
                    .block(STEP_TIMEOUT);

            log.info("=== Graceful shutdown completed successfully ===");
        } catch (RuntimeException e) {
            log.error("Error during graceful shutdown", e);
        }
    }
}
