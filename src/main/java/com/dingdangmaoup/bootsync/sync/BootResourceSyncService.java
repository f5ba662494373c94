package com.dingdangmaoup.bootsync.sync;

import com.dingdangmaoup.bootsync.config.properties.SyncProperties;
import com.dingdangmaoup.bootsync.coordination.DistributedLock;
import com.dingdangmaoup.bootsync.metrics.SyncMetrics;
import com.dingdangmaoup.bootsync.region.RegionDiscoveryService;
import com.dingdangmaoup.bootsync.region.RegionInfo;
import com.dingdangmaoup.bootsync.resource.BootResourceFile;
import com.dingdangmaoup.bootsync.resource.BootResourceFileService;
import com.dingdangmaoup.bootsync.resource.repository.BootResourceFileRepository;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Brings the image storage of this region in line with the boot resource records:
 * files with an upstream source are fetched from the mirror, the others are copied
 * from regions that already hold them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BootResourceSyncService {

    private final DiskSpaceChecker diskSpaceChecker;
    private final BootResourceDownloader downloader;
    private final BootResourceFileService fileService;
    private final BootResourceFileRepository fileRepository;
    private final RegionDiscoveryService regionDiscoveryService;
    private final DistributedLock distributedLock;
    private final ImageStorage imageStorage;
    private final SyncProperties syncProperties;
    private final SyncMetrics syncMetrics;

    private final Random random = new Random();
    private final AtomicBoolean peerSyncRunning = new AtomicBoolean(false);

    /**
     * Run a sync: check the disk space, download the files that have upstream sources,
     * then copy from other regions whatever this region still misses.
     */
    public Mono<Void> sync(SyncRequest request) {
        return checkDiskSpace(request.getRequirement())
                .then(downloadFromUpstream(request))
                .then(syncFromPeers(request.getResources()))
                .doOnSuccess(v -> log.info("Sync complete"))
                .doOnError(error -> {
                    syncMetrics.recordSyncFailure();
                    log.error("Sync aborted: {}", error.getMessage());
                });
    }

    private Mono<Void> checkDiskSpace(SpaceRequirement requirement) {
        if (requirement == null) {
            return Mono.empty();
        }
        return diskSpaceChecker.checkDiskSpace(requirement)
                .flatMap(enough -> enough
                        ? Mono.<Void>empty()
                        : Mono.error(new SyncException("some region controllers don't have enough disk space")));
    }

    private Mono<Void> downloadFromUpstream(SyncRequest request) {
        List<ResourceDownloadParam> upstream = request.getResources().stream()
                .filter(resource -> !resource.getSourceList().isEmpty())
                .map(resource -> resource.toBuilder().httpProxy(request.getHttpProxy()).build())
                .toList();
        if (upstream.isEmpty()) {
            return Mono.empty();
        }
        log.info("Syncing {} resources from upstream", upstream.size());
        return downloadAll(upstream, "some files could not be downloaded, aborting");
    }

    /**
     * Copy from other regions the resources this region does not hold completely.
     * Sources are the regions holding a complete copy of every file of the resource.
     */
    public Mono<Void> syncFromPeers(List<ResourceDownloadParam> resources) {
        String self = regionDiscoveryService.currentRegionId();
        return regionDiscoveryService.discoverRegions()
                .collectMap(RegionInfo::getRegionId, Function.identity())
                .flatMap(regions -> {
                    if (regions.size() < 2) {
                        return Mono.empty();
                    }
                    return Flux.fromIterable(resources)
                            .concatMap(resource -> holders(resource, regions.keySet())
                                    .flatMap(holders -> peerDownload(resource, holders, regions, self)))
                            .collectList()
                            .flatMap(downloads -> downloads.isEmpty()
                                    ? Mono.<Void>empty()
                                    : downloadAll(downloads, "some files could not be synced, aborting"));
                });
    }

    private Mono<ResourceDownloadParam> peerDownload(ResourceDownloadParam resource, Set<String> holders,
                                                     Map<String, RegionInfo> regions, String self) {
        if (holders.contains(self)) {
            return Mono.empty();
        }
        if (holders.isEmpty()) {
            log.error("File {} has no complete copy available, skipping", resource.getSha256());
            return Mono.empty();
        }
        List<String> endpoints = holders.stream()
                .sorted()
                .map(regionId -> fileUrl(regions.get(regionId), resource.getFilenameOnDisk()))
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.shuffle(endpoints, random);
        List<String> sources = new ArrayList<>(endpoints.subList(0, Math.min(endpoints.size(), syncProperties.getMaxSources())));
        return Mono.just(resource.toBuilder()
                .sourceList(sources)
                .httpProxy(null)
                .build());
    }

    /**
     * Live regions holding every file of the resource
     */
    private Mono<Set<String>> holders(ResourceDownloadParam resource, Set<String> liveRegions) {
        return Flux.fromIterable(resource.getFileIds())
                .concatMap(fileId -> fileService.getById(fileId)
                        .flatMapMany(fileService::regionsWithCompleteCopy)
                        .collect(Collectors.toSet()))
                .reduce(new HashSet<>(liveRegions), (common, complete) -> {
                    common.retainAll(complete);
                    return common;
                })
                .map(common -> (Set<String>) common);
    }

    String fileUrl(RegionInfo region, String filenameOnDisk) {
        String path = syncProperties.getFileEndpointPath();
        if (!path.endsWith("/")) {
            path = path + "/";
        }
        return region.getHttpUrl() + path + filenameOnDisk + "/";
    }

    private Mono<Void> downloadAll(List<ResourceDownloadParam> downloads, String failure) {
        return Flux.fromIterable(downloads)
                .flatMap(downloader::download, syncProperties.getConcurrentDownloads())
                .all(Boolean::booleanValue)
                .flatMap(all -> all ? Mono.<Void>empty() : Mono.error(new SyncException(failure)));
    }

    /**
     * Remove files from the image storage of this region
     */
    public Mono<Boolean> deleteFiles(List<ResourceIdentifier> files) {
        return Flux.fromIterable(files)
                .concatMap(file -> {
                    log.debug("Attempt to delete {}", file);
                    return distributedLock.withLock(DistributedLock.fileLockKey(file.getFilenameOnDisk()),
                                    imageStorage.reactiveFile(file.getSha256(), file.getFilenameOnDisk(), 0)
                                            .unlink()
                                            .thenReturn(file))
                            .doOnNext(deleted -> log.info("File {} deleted", deleted));
                })
                .then(Mono.just(true));
    }

    /**
     * Periodically copy from other regions the files recorded in the database but not
     * held by this region, so regions that join or come back catch up.
     */
    @Scheduled(fixedDelayString = "${bootsync.sync.peer-sync-interval:60s}",
            initialDelayString = "${bootsync.sync.peer-sync-interval:60s}")
    public void scheduledPeerSync() {
        if (!peerSyncRunning.compareAndSet(false, true)) {
            log.debug("Previous peer sync still running");
            return;
        }
        recordedResources()
                .flatMap(this::syncFromPeers)
                .doFinally(signal -> peerSyncRunning.set(false))
                .subscribe(
                        v -> {
                        },
                        error -> log.warn("Peer sync failed: {}", error.getMessage()));
    }

    /**
     * One download per distinct sha256 among the recorded files
     */
    Mono<List<ResourceDownloadParam>> recordedResources() {
        return fileRepository.findAll()
                .filter(file -> file.getFilenameOnDisk() != null)
                .collect(LinkedHashMap<String, ResourceDownloadParam>::new, (bySha, file) -> {
                    ResourceDownloadParam existing = bySha.get(file.getSha256());
                    if (existing != null) {
                        existing.getFileIds().add(file.getId());
                    } else {
                        bySha.put(file.getSha256(), toPeerDownload(file));
                    }
                })
                .map(bySha -> List.copyOf(bySha.values()));
    }

    private static ResourceDownloadParam toPeerDownload(BootResourceFile file) {
        List<Long> fileIds = new ArrayList<>();
        fileIds.add(file.getId());
        return ResourceDownloadParam.builder()
                .fileIds(fileIds)
                .sha256(file.getSha256())
                .filenameOnDisk(file.getFilenameOnDisk())
                .totalSize(file.getSize())
                .build();
    }
}
