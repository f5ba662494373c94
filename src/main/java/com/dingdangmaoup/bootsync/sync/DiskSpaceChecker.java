package com.dingdangmaoup.bootsync.sync;

import com.dingdangmaoup.bootsync.region.RegionDiscoveryService;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Checks that this region can hold the resources of a sync
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiskSpaceChecker {

    private final ImageStorage imageStorage;
    private final RegionDiscoveryService regionDiscoveryService;

    /**
     * @return Mono emitting true when the free space, plus the bytes already stored when
     *         the requirement is the total size of the resources, exceeds the requirement
     */
    public Mono<Boolean> checkDiskSpace(SpaceRequirement requirement) {
        Mono<Long> free = imageStorage.getAvailableSpace();
        if (requirement.countsStoredBytes()) {
            free = free.zipWith(imageStorage.getStoredBytes(), Long::sum);
        }
        long required = requirement.requiredBytes();
        return free.map(available -> {
            if (available > required) {
                return true;
            }
            log.error("Not enough disk space at controller '{}', needs {} to store all resources.",
                    regionDiscoveryService.currentRegionId(), humanReadable(required));
            return false;
        });
    }

    static String humanReadable(long bytes) {
        String[] units = {"bytes", "KiB", "MiB", "GiB", "TiB"};
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024;
            unit++;
        }
        if (unit == 0) {
            return bytes + " bytes";
        }
        return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
    }
}
