package com.dingdangmaoup.bootsync.storage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Entry point to the image storage directory.
 */
@Slf4j
public class ImageStorage {

    @Getter
    private final Path basePath;
    private final ImageStoreIo io;

    public ImageStorage(Path basePath, ImageStoreIo io) {
        this.basePath = basePath;
        this.io = io;
    }

    public LocalBootResourceFile file(String sha256, String filenameOnDisk, long totalSize) {
        return new LocalBootResourceFile(basePath, io, sha256, filenameOnDisk, totalSize);
    }

    public ReactiveLocalBootResourceFile reactiveFile(String sha256, String filenameOnDisk, long totalSize) {
        return new ReactiveLocalBootResourceFile(file(sha256, filenameOnDisk, totalSize));
    }

    /**
     * Get free space on the filesystem holding the storage
     *
     * @return Mono emitting usable bytes
     */
    public Mono<Long> getAvailableSpace() {
        return Mono.fromCallable(() -> io.usableSpace(basePath))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(IOException.class, e -> new StorageException("Failed to get available space", e));
    }

    /**
     * Get the total size of everything under the storage, extracted archives included
     *
     * @return Mono emitting the number of bytes
     */
    public Mono<Long> getStoredBytes() {
        return Mono.fromCallable(() -> {
                    if (!Files.isDirectory(basePath)) {
                        return 0L;
                    }
                    try (Stream<Path> files = Files.walk(basePath)) {
                        return files.filter(Files::isRegularFile)
                                .mapToLong(this::sizeOf)
                                .sum();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(IOException.class, e -> new StorageException("Failed to measure image storage", e));
    }

    /**
     * Locate a stored file
     *
     * @param filenameOnDisk name of the file in the storage root
     * @return Mono emitting the path if the file exists
     */
    public Mono<Optional<Path>> findFile(String filenameOnDisk) {
        return Mono.fromCallable(() -> {
            Path path = basePath.resolve(filenameOnDisk).normalize();
            if (!path.getParent().equals(basePath.normalize()) || !Files.isRegularFile(path)) {
                return Optional.<Path>empty();
            }
            return Optional.of(path);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * List the names of the files stored directly in the storage root
     */
    public Flux<String> listFilenames() {
        return Mono.fromCallable(() -> {
                    if (!Files.isDirectory(basePath)) {
                        return List.<String>of();
                    }
                    try (Stream<Path> files = Files.list(basePath)) {
                        return files.filter(Files::isRegularFile)
                                .map(path -> path.getFileName().toString())
                                .sorted()
                                .toList();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable);
    }

    private long sizeOf(Path path) {
        try {
            return io.size(path);
        } catch (IOException e) {
            throw new StorageException("Failed to read size of " + path, e);
        }
    }
}
