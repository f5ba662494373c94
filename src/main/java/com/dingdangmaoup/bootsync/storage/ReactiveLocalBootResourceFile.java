package com.dingdangmaoup.bootsync.storage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;

/**
 * Non-blocking view of a {@link LocalBootResourceFile}.
 * <p>
 * Every disk access runs on a blocking-capable scheduler; no state is kept between
 * calls, so a store cancelled between two chunks leaves a partial file whose size is
 * exactly the bytes written so far.
 */
@Slf4j
public class ReactiveLocalBootResourceFile {

    @Getter
    private final LocalBootResourceFile file;
    private final Scheduler scheduler;

    public ReactiveLocalBootResourceFile(LocalBootResourceFile file) {
        this(file, Schedulers.boundedElastic());
    }

    public ReactiveLocalBootResourceFile(LocalBootResourceFile file, Scheduler scheduler) {
        this.file = file;
        this.scheduler = scheduler;
    }

    public Mono<Long> size() {
        return Mono.fromCallable(file::size).subscribeOn(scheduler);
    }

    public Mono<Boolean> complete() {
        return Mono.fromCallable(file::complete).subscribeOn(scheduler);
    }

    public Mono<Boolean> valid() {
        return Mono.fromCallable(file::valid).subscribeOn(scheduler);
    }

    public Mono<Void> unlink() {
        return Mono.fromRunnable(file::unlink).subscribeOn(scheduler).then();
    }

    public Mono<Path> extractFile(String targetSubdirectory) {
        return Mono.fromCallable(() -> file.extractFile(targetSubdirectory)).subscribeOn(scheduler);
    }

    /**
     * Append the content after the bytes already on disk and verify the result.
     *
     * @param content remaining bytes of the file, consumed and released chunk by chunk
     * @return Mono emitting the final file size once the content is complete and valid
     */
    public Mono<Long> store(Flux<DataBuffer> content) {
        return storeChunks(content)
                .then(Mono.fromCallable(() -> {
                    file.commitStore();
                    return file.getTotalSize();
                }).subscribeOn(scheduler));
    }

    /**
     * Append the content without the final size and hash verification.
     *
     * @return Mono emitting the file size after the last chunk
     */
    public Mono<Long> storeChunks(Flux<DataBuffer> content) {
        return Mono.usingWhen(
                Mono.fromCallable(file::openStore).subscribeOn(scheduler),
                writer -> content
                        .concatMap(buffer -> Mono.fromCallable(() -> {
                            try {
                                byte[] bytes = new byte[buffer.readableByteCount()];
                                buffer.read(bytes);
                                writer.write(bytes);
                                return writer.position();
                            } finally {
                                DataBufferUtils.release(buffer);
                            }
                        }).subscribeOn(scheduler))
                        .last(writer.position()),
                writer -> close(writer),
                (writer, error) -> close(writer).then(discardOnSizeMismatch(error)),
                writer -> close(writer)
                        .doOnSuccess(v -> log.debug("Store of {} cancelled at {} bytes",
                                file.getFilenameOnDisk(), writer.position())));
    }

    private Mono<Void> close(StoreWriter writer) {
        return Mono.fromCallable(() -> {
            writer.close();
            return writer.position();
        }).subscribeOn(scheduler).then();
    }

    private Mono<Void> discardOnSizeMismatch(Throwable error) {
        if (error instanceof LocalStoreFileSizeMismatchException) {
            return unlink();
        }
        return Mono.empty();
    }
}
