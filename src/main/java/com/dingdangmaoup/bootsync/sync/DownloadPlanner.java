package com.dingdangmaoup.bootsync.sync;

import com.dingdangmaoup.bootsync.config.properties.SyncProperties;
import com.dingdangmaoup.bootsync.resource.BootResource;
import com.dingdangmaoup.bootsync.resource.BootResourceFile;
import com.dingdangmaoup.bootsync.resource.BootResourceFileService;
import com.dingdangmaoup.bootsync.resource.BootResourceFileType;
import com.dingdangmaoup.bootsync.resource.BootResourceSet;
import com.dingdangmaoup.bootsync.resource.repository.BootResourceFileRepository;
import com.dingdangmaoup.bootsync.resource.repository.FileSyncRepository;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Works out which files of the selected products this cluster still has to download.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadPlanner {

    private final BootResourceFileRepository fileRepository;
    private final FileSyncRepository fileSyncRepository;
    private final BootResourceFileService fileService;
    private final ImageStorage imageStorage;
    private final SyncProperties syncProperties;

    /**
     * Plan the downloads of the products of one boot source. Requests for the same
     * sha256 are merged into one download.
     *
     * @param sourceUrl mirror URL the product paths are relative to
     */
    public Mono<DownloadPlan> plan(String sourceUrl, List<DownloadableProduct> products) {
        DownloadPlan plan = new DownloadPlan();
        return Flux.fromIterable(products)
                .concatMap(product -> filesToDownload(sourceUrl, product)
                        .doOnNext(plan::add)
                        .then(Mono.fromRunnable(() -> plan.addResourceId(product.getResource().getId()))))
                .then(Mono.fromCallable(() -> {
                    log.info("{} files to download from {}", plan.getDownloads().size(), sourceUrl);
                    return plan;
                }));
    }

    /**
     * Files of one product that are missing locally or on another region
     */
    public Flux<ResourceDownloadParam> filesToDownload(String sourceUrl, DownloadableProduct product) {
        BootResourceSet set = product.getResourceSet();
        boolean hasSquashfs = product.getFiles().stream()
                .anyMatch(f -> f.getFile().getFiletype() == BootResourceFileType.SQUASHFS_IMAGE);

        Mono<Void> prepare = hasSquashfs ? deleteRootImages(set) : Mono.empty();
        return prepare.thenMany(Flux.fromIterable(product.getFiles()))
                .filter(f -> !(hasSquashfs && f.getFile().getFiletype() == BootResourceFileType.ROOT_IMAGE))
                .concatMap(f -> getOrCreate(set, f.getFile())
                        .filterWhen(file -> alreadyDownloaded(file).map(done -> !done))
                        .map(file -> toDownload(sourceUrl, product.getResource(), f.getPath(), file)));
    }

    /**
     * A stream that switched to SquashFS images supersedes the root image tarball
     */
    private Mono<Void> deleteRootImages(BootResourceSet set) {
        return fileRepository.findByResourceSetId(set.getId())
                .filter(file -> file.getFiletype() == BootResourceFileType.ROOT_IMAGE)
                .concatMap(file -> fileRepository.deleteById(file.getId())
                        .then(fileSyncRepository.deleteFile(file.getId()))
                        .thenReturn(file))
                .count()
                .doOnNext(deleted -> {
                    if (deleted > 0) {
                        log.debug("Deleted a root image tarball in favour of a root squashfs.");
                    }
                })
                .then();
    }

    private Mono<BootResourceFile> getOrCreate(BootResourceSet set, BootResourceFile file) {
        return fileRepository.findByResourceSetId(set.getId())
                .filter(existing -> existing.getFilename().equals(file.getFilename())
                        && existing.getSha256().equals(file.getSha256()))
                .next()
                .switchIfEmpty(Mono.defer(() -> fileService.calculateFilenameOnDisk(file.getSha256())
                        .flatMap(filenameOnDisk -> fileRepository.save(file.toBuilder()
                                .id(null)
                                .resourceSetId(set.getId())
                                .filenameOnDisk(filenameOnDisk)
                                .build()))));
    }

    private Mono<Boolean> alreadyDownloaded(BootResourceFile file) {
        return imageStorage.reactiveFile(file.getSha256(), file.getFilenameOnDisk(), file.getSize())
                .complete()
                .filter(Boolean::booleanValue)
                .flatMap(complete -> fileService.isSyncComplete(file))
                .defaultIfEmpty(false)
                .doOnNext(done -> {
                    if (done) {
                        log.debug("File with sha256 '{}' already downloaded.", file.getSha256());
                    }
                });
    }

    private ResourceDownloadParam toDownload(String sourceUrl, BootResource resource, String path,
                                             BootResourceFile file) {
        List<String> extractPaths = new ArrayList<>();
        if (file.getFiletype() == BootResourceFileType.ARCHIVE_TAR_XZ && resource.getBootloaderType() != null) {
            String arch = resource.getArchitecture().split("/")[0];
            extractPaths.add(syncProperties.getBootloadersDir() + "/" + resource.getBootloaderType() + "/" + arch);
        }
        List<Long> fileIds = new ArrayList<>();
        fileIds.add(file.getId());
        List<String> sources = new ArrayList<>();
        sources.add(joinUrl(sourceUrl, path));
        return ResourceDownloadParam.builder()
                .fileIds(fileIds)
                .sourceList(sources)
                .sha256(file.getSha256())
                .filenameOnDisk(file.getFilenameOnDisk())
                .totalSize(file.getSize())
                .extractPaths(extractPaths)
                .build();
    }

    static String joinUrl(String base, String path) {
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }
}
