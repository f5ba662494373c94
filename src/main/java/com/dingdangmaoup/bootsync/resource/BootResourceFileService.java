package com.dingdangmaoup.bootsync.resource;

import com.dingdangmaoup.bootsync.config.properties.StorageProperties;
import com.dingdangmaoup.bootsync.region.RegionDiscoveryService;
import com.dingdangmaoup.bootsync.region.RegionInfo;
import com.dingdangmaoup.bootsync.resource.repository.BootResourceFileRepository;
import com.dingdangmaoup.bootsync.resource.repository.FileSyncRepository;
import com.dingdangmaoup.bootsync.storage.FilenameOnDisk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Boot resource file records and their per-region sync state
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BootResourceFileService {

    private final BootResourceFileRepository fileRepository;
    private final FileSyncRepository fileSyncRepository;
    private final RegionDiscoveryService regionDiscoveryService;
    private final StorageProperties storageProperties;

    public Mono<BootResourceFile> getById(long fileId) {
        return fileRepository.findById(fileId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.file(fileId)));
    }

    /**
     * Shortest free on-disk name for a file with this sha256. Files with the same sha256
     * share a name; a prefix already taken by another sha256 is widened until unique.
     */
    public Mono<String> calculateFilenameOnDisk(String sha256) {
        String shortest = FilenameOnDisk.shortSha(sha256, storageProperties.getFilenameLength());
        return fileRepository.findAll()
                .filter(file -> file.getFilenameOnDisk() != null && file.getFilenameOnDisk().startsWith(shortest))
                .collectMap(BootResourceFile::getFilenameOnDisk, BootResourceFile::getSha256)
                .map(owners -> {
                    String name = FilenameOnDisk.allocate(sha256, storageProperties.getFilenameLength(),
                            candidate -> Optional.ofNullable(owners.get(candidate)));
                    if (!name.equals(shortest)) {
                        log.warn("Filename {} already used by another file, storing {} as {}", shortest, sha256, name);
                    }
                    return name;
                });
    }

    /**
     * Record that this region holds {@code size} bytes of each file.
     */
    public Mono<Void> recordProgress(Collection<Long> fileIds, long size) {
        String regionId = regionDiscoveryService.currentRegionId();
        return Flux.fromIterable(fileIds)
                .concatMap(fileId -> fileSyncRepository.setSyncedBytes(fileId, regionId, size))
                .then();
    }

    /**
     * Live regions that reported the whole file
     */
    public Flux<String> regionsWithCompleteCopy(BootResourceFile file) {
        return Mono.zip(fileSyncRepository.getSyncedBytes(file.getId()), liveRegionIds())
                .flatMapMany(state -> Flux.fromIterable(state.getT1().entrySet())
                        .filter(entry -> state.getT2().contains(entry.getKey())))
                .filter(entry -> entry.getValue() >= file.getSize())
                .map(Map.Entry::getKey)
                .sort();
    }

    /**
     * Whether every live region holds the whole file
     */
    public Mono<Boolean> isSyncComplete(BootResourceFile file) {
        return Mono.zip(fileSyncRepository.getSyncedBytes(file.getId()), liveRegionIds())
                .map(state -> !state.getT2().isEmpty() && state.getT2().stream()
                        .allMatch(regionId -> state.getT1().getOrDefault(regionId, 0L) >= file.getSize()));
    }

    public Mono<Boolean> isSyncCompleteOnRegion(BootResourceFile file, String regionId) {
        return fileSyncRepository.getSyncedBytes(file.getId())
                .map(synced -> synced.getOrDefault(regionId, 0L) >= file.getSize());
    }

    private Mono<Set<String>> liveRegionIds() {
        return regionDiscoveryService.discoverRegions()
                .map(RegionInfo::getRegionId)
                .collect(Collectors.toSet());
    }
}
