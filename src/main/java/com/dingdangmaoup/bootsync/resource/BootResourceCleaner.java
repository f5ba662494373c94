package com.dingdangmaoup.bootsync.resource;

import com.dingdangmaoup.bootsync.resource.repository.BootResourceFileRepository;
import com.dingdangmaoup.bootsync.resource.repository.BootResourceRepository;
import com.dingdangmaoup.bootsync.resource.repository.BootResourceSetRepository;
import com.dingdangmaoup.bootsync.resource.repository.FileSyncRepository;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Garbage collection of superseded boot resource sets
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BootResourceCleaner {

    private final BootResourceRepository resourceRepository;
    private final BootResourceSetRepository setRepository;
    private final BootResourceFileRepository fileRepository;
    private final FileSyncRepository fileSyncRepository;
    private final BootResourceSetService setService;
    private final ImageStorage imageStorage;

    /**
     * For every synced resource keep only the newest complete set; incomplete sets and
     * older complete ones are deleted. Resources left without sets are deleted too, and
     * local files no remaining record refers to are unlinked.
     *
     * @return Mono emitting the deleted file records
     */
    public Mono<List<BootResourceFile>> deleteOldBootResourceSets() {
        return syncedResources()
                .concatMap(this::deleteOldSets)
                .collectList()
                .flatMap(removed -> deleteResourcesWithoutSets()
                        .then(unlinkUnreferenced(removed))
                        .thenReturn(removed))
                .doOnSuccess(removed -> log.info("Removed {} boot resource file(s) of old sets", removed.size()));
    }

    private Flux<BootResource> syncedResources() {
        return resourceRepository.findAll()
                .filter(resource -> resource.getRtype() == BootResource.BootResourceType.SYNCED);
    }

    private Flux<BootResourceFile> deleteOldSets(BootResource resource) {
        return Flux.defer(() -> {
            AtomicBoolean foundComplete = new AtomicBoolean();
            return setRepository.findByResourceIdNewestFirst(resource.getId())
                    .concatMap(set -> setService.isSyncComplete(set.getId())
                            .flatMapMany(complete -> {
                                if (complete && foundComplete.compareAndSet(false, true)) {
                                    return Flux.empty();
                                }
                                return deleteSet(resource, set);
                            }));
        });
    }

    private Flux<BootResourceFile> deleteSet(BootResource resource, BootResourceSet set) {
        return fileRepository.findByResourceSetId(set.getId())
                .concatMap(file -> fileRepository.deleteById(file.getId())
                        .then(fileSyncRepository.deleteFile(file.getId()))
                        .thenReturn(file))
                .concatWith(setRepository.deleteById(set.getId())
                        .doOnSuccess(v -> log.info("Deleted boot resource set {} ({}) of {}",
                                set.getId(), set.getVersion(), resource.getName()))
                        .then(Mono.empty()));
    }

    private Mono<Void> deleteResourcesWithoutSets() {
        return syncedResources()
                .concatMap(resource -> setRepository.findByResourceIdNewestFirst(resource.getId())
                        .hasElements()
                        .flatMap(hasSets -> hasSets
                                ? Mono.<Void>empty()
                                : resourceRepository.deleteById(resource.getId())
                                        .doOnSuccess(v -> log.info("Deleted boot resource {} without sets",
                                                resource.getName()))))
                .then();
    }

    private Mono<Void> unlinkUnreferenced(List<BootResourceFile> removed) {
        Map<String, BootResourceFile> byName = new LinkedHashMap<>();
        removed.stream()
                .filter(file -> file.getFilenameOnDisk() != null)
                .forEach(file -> byName.putIfAbsent(file.getFilenameOnDisk(), file));
        return Flux.fromIterable(byName.values())
                .concatMap(file -> fileRepository.findByFilenameOnDisk(file.getFilenameOnDisk())
                        .hasElements()
                        .flatMap(stillUsed -> stillUsed
                                ? Mono.<Void>empty()
                                : imageStorage.reactiveFile(file.getSha256(), file.getFilenameOnDisk(), file.getSize())
                                        .unlink()))
                .then();
    }
}
