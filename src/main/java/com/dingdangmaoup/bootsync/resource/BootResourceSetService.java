package com.dingdangmaoup.bootsync.resource;

import com.dingdangmaoup.bootsync.region.RegionDiscoveryService;
import com.dingdangmaoup.bootsync.region.RegionInfo;
import com.dingdangmaoup.bootsync.resource.repository.BootResourceFileRepository;
import com.dingdangmaoup.bootsync.resource.repository.BootResourceRepository;
import com.dingdangmaoup.bootsync.resource.repository.BootResourceSetRepository;
import com.dingdangmaoup.bootsync.resource.repository.FileSyncRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sync progress and readiness of boot resource sets.
 * <p>
 * Every query reads the set's file list once. Progress may lag behind in-flight
 * transfers but never runs ahead of them, as synced byte counts only grow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BootResourceSetService {

    public static final double COMPLETE = 100.0;

    private final BootResourceRepository resourceRepository;
    private final BootResourceSetRepository setRepository;
    private final BootResourceFileRepository fileRepository;
    private final FileSyncRepository fileSyncRepository;
    private final RegionDiscoveryService regionDiscoveryService;

    /**
     * Percentage of the set's bytes present across all regions:
     * {@code synced / (size of all files * number of regions) * 100}.
     *
     * @throws NotFoundException if the set does not exist
     */
    public Mono<Double> getSyncProgress(long setId) {
        return files(setId).flatMap(this::syncProgress);
    }

    public Mono<Boolean> isSyncComplete(long setId) {
        return getSyncProgress(setId).map(progress -> progress == COMPLETE);
    }

    /**
     * Newest set of the resource that is complete on every region
     *
     * @return Mono completing empty when no set qualifies
     * @throws NotFoundException if the resource does not exist
     */
    public Mono<BootResourceSet> getLatestCompleteSetForBootResource(long resourceId) {
        return resourceRepository.findById(resourceId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.resource(resourceId)))
                .flatMapMany(resource -> setRepository.findByResourceIdNewestFirst(resourceId))
                .concatMap(set -> isSyncComplete(set.getId())
                        .filter(Boolean::booleanValue)
                        .map(complete -> set))
                .next();
    }

    /**
     * A set is usable when it has a kernel and a root filesystem to boot into.
     */
    public Mono<Boolean> isUsable(long setId) {
        return files(setId).map(files -> usable(fileTypes(files)));
    }

    /**
     * A set is xinstallable when it has a root tarball or disk image for the fast-path installer.
     */
    public Mono<Boolean> isXinstallable(long setId) {
        return files(setId).map(files -> xinstallable(fileTypes(files)));
    }

    /**
     * Progress, completeness and readiness of a set in one pass over its files
     */
    public Mono<SyncStatus> getSyncStatus(long setId) {
        return files(setId).flatMap(files -> syncProgress(files).map(progress -> {
            Set<BootResourceFileType> types = fileTypes(files);
            return SyncStatus.builder()
                    .setId(setId)
                    .progress(progress)
                    .complete(progress == COMPLETE)
                    .usable(usable(types))
                    .xinstallable(xinstallable(types))
                    .build();
        }));
    }

    Mono<Double> syncProgress(List<BootResourceFile> files) {
        long totalSize = files.stream().mapToLong(BootResourceFile::getSize).sum();
        return liveRegionIds().flatMap(regions -> {
            long expected = totalSize * regions.size();
            if (expected == 0) {
                return Mono.just(0.0);
            }
            return Flux.fromIterable(files)
                    .<Long>flatMap(file -> fileSyncRepository.getSyncedBytes(file.getId())
                            .map(syncedByRegion -> liveSyncedBytes(file, syncedByRegion, regions)))
                    .reduce(0L, Long::sum)
                    .map(synced -> COMPLETE * synced / expected);
        });
    }

    // records left by expired or deregistered regions are not counted
    private static long liveSyncedBytes(BootResourceFile file, Map<String, Long> syncedByRegion,
                                        Set<String> regions) {
        return syncedByRegion.entrySet().stream()
                .filter(entry -> regions.contains(entry.getKey()))
                .mapToLong(entry -> Math.min(entry.getValue(), file.getSize()))
                .sum();
    }

    private Mono<Set<String>> liveRegionIds() {
        return regionDiscoveryService.discoverRegions()
                .map(RegionInfo::getRegionId)
                .collect(Collectors.toSet());
    }

    private Mono<List<BootResourceFile>> files(long setId) {
        return setRepository.findById(setId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.resourceSet(setId)))
                .flatMap(set -> fileRepository.findByResourceSetId(setId).collectList());
    }

    private static boolean usable(Set<BootResourceFileType> types) {
        return types.contains(BootResourceFileType.BOOT_KERNEL)
                && types.stream().anyMatch(BootResourceFileType.ROOT_TYPES::contains);
    }

    private static boolean xinstallable(Set<BootResourceFileType> types) {
        return types.stream().anyMatch(BootResourceFileType.XINSTALL_TYPES::contains);
    }

    private static Set<BootResourceFileType> fileTypes(List<BootResourceFile> files) {
        return files.stream()
                .map(BootResourceFile::getFiletype)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(BootResourceFileType.class)));
    }
}
