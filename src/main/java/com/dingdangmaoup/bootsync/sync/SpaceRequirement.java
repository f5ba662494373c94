package com.dingdangmaoup.bootsync.sync;

import lombok.Value;

/**
 * Disk space a region needs before a sync starts. Exactly one of the two modes is used:
 * a plain amount of free space, or the total size of every resource, in which case the
 * bytes already stored count as available.
 */
@Value
public class SpaceRequirement {

    Long minFreeSpace;
    Long totalResourcesSize;

    private SpaceRequirement(Long minFreeSpace, Long totalResourcesSize) {
        if (minFreeSpace != null && totalResourcesSize != null) {
            throw new IllegalArgumentException(
                    "Only one of 'min_free_space' and 'total_resources_size' can be specified.");
        }
        this.minFreeSpace = minFreeSpace;
        this.totalResourcesSize = totalResourcesSize;
    }

    public static SpaceRequirement of(Long minFreeSpace, Long totalResourcesSize) {
        return new SpaceRequirement(minFreeSpace, totalResourcesSize);
    }

    public static SpaceRequirement minFreeSpace(long bytes) {
        return new SpaceRequirement(bytes, null);
    }

    public static SpaceRequirement totalResourcesSize(long bytes) {
        return new SpaceRequirement(null, bytes);
    }

    public boolean countsStoredBytes() {
        return totalResourcesSize != null;
    }

    public long requiredBytes() {
        if (totalResourcesSize != null) {
            return totalResourcesSize;
        }
        return minFreeSpace != null ? minFreeSpace : 0L;
    }
}
