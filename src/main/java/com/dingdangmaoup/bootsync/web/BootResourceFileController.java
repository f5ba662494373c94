package com.dingdangmaoup.bootsync.web;

import com.dingdangmaoup.bootsync.config.properties.StorageProperties;
import com.dingdangmaoup.bootsync.coordination.DistributedLock;
import com.dingdangmaoup.bootsync.metrics.SyncMetrics;
import com.dingdangmaoup.bootsync.resource.BootResourceFile;
import com.dingdangmaoup.bootsync.resource.BootResourceFileService;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import com.dingdangmaoup.bootsync.storage.LocalStoreAllocationFailException;
import com.dingdangmaoup.bootsync.storage.LocalStoreFileSizeMismatchException;
import com.dingdangmaoup.bootsync.storage.LocalStoreInvalidHashException;
import com.dingdangmaoup.bootsync.storage.ReactiveLocalBootResourceFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Boot resource file content: served to peer regions and uploaded by clients
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class BootResourceFileController {

    private final ImageStorage imageStorage;
    private final BootResourceFileService fileService;
    private final DistributedLock distributedLock;
    private final StorageProperties storageProperties;
    private final SyncMetrics syncMetrics;

    /**
     * GET a stored file. Range requests are answered with partial content so an
     * interrupted peer download can resume.
     */
    @GetMapping("/MAAS/boot-resources/{filenameOnDisk}/")
    public Mono<ResponseEntity<Resource>> getFile(@PathVariable String filenameOnDisk) {
        log.debug("GET boot resource file: {}", filenameOnDisk);

        return imageStorage.findFile(filenameOnDisk)
                .map(path -> path
                        .map(found -> ResponseEntity.ok()
                                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                                .<Resource>body(new FileSystemResource(found)))
                        .orElseGet(() -> {
                            log.info("Boot resource file not found: {}", filenameOnDisk);
                            return ResponseEntity.notFound().build();
                        }));
    }

    /**
     * Upload the content of a known boot resource file
     */
    @PostMapping(value = "/MAAS/api/boot-resources/files/{fileId}/upload",
            consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public Mono<ResponseEntity<UploadResult>> upload(@PathVariable long fileId,
                                                     @RequestBody Flux<DataBuffer> body) {
        log.info("Upload of boot resource file {}", fileId);

        return fileService.getById(fileId)
                .flatMap(file -> distributedLock.withLock(
                                DistributedLock.fileLockKey(file.getFilenameOnDisk()),
                                storeUpload(file, body))
                        .flatMap(size -> fileService.recordProgress(List.of(fileId), size)
                                .thenReturn(UploadResult.builder()
                                        .fileId(fileId)
                                        .sha256(file.getSha256())
                                        .filenameOnDisk(file.getFilenameOnDisk())
                                        .size(size)
                                        .build())))
                .map(ResponseEntity::ok)
                .doOnError(this::recordFailure);
    }

    private Mono<Long> storeUpload(BootResourceFile file, Flux<DataBuffer> body) {
        ReactiveLocalBootResourceFile local =
                imageStorage.reactiveFile(file.getSha256(), file.getFilenameOnDisk(), file.getSize());
        return local.valid()
                .flatMap(valid -> {
                    if (valid) {
                        log.info("Boot resource file {} already stored, discarding upload",
                                file.getFilenameOnDisk());
                        return body.doOnNext(DataBufferUtils::release)
                                .then(Mono.just(file.getSize()));
                    }
                    return local.store(rechunk(body))
                            .doOnNext(size -> {
                                syncMetrics.recordUpload(size);
                                log.info("Stored uploaded boot resource file {} ({} bytes)",
                                        file.getFilenameOnDisk(), size);
                            });
                });
    }

    /**
     * Merge the incoming buffers into chunks of at least the configured size to limit
     * the number of disk writes and digest updates.
     */
    Flux<DataBuffer> rechunk(Flux<DataBuffer> body) {
        long chunkSize = storageProperties.getChunkSize().toBytes();
        return Flux.defer(() -> {
                    AtomicLong buffered = new AtomicLong();
                    return body.bufferUntil(buffer -> {
                        if (buffered.addAndGet(buffer.readableByteCount()) >= chunkSize) {
                            buffered.set(0);
                            return true;
                        }
                        return false;
                    });
                })
                .concatMap(buffers -> DataBufferUtils.join(Flux.fromIterable(buffers)))
                .doOnDiscard(DataBuffer.class, DataBufferUtils::release);
    }

    private void recordFailure(Throwable error) {
        if (error instanceof LocalStoreFileSizeMismatchException) {
            syncMetrics.recordUploadFailure("size-mismatch");
        } else if (error instanceof LocalStoreInvalidHashException) {
            syncMetrics.recordUploadFailure("invalid-hash");
        } else if (error instanceof LocalStoreAllocationFailException) {
            syncMetrics.recordUploadFailure("no-space");
        }
    }
}
