package com.dingdangmaoup.bootsync.resource.repository;

import com.dingdangmaoup.bootsync.resource.BootResourceFile;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface BootResourceFileRepository {

    Mono<BootResourceFile> findById(long id);

    Flux<BootResourceFile> findByResourceSetId(long resourceSetId);

    Flux<BootResourceFile> findByFilenameOnDisk(String filenameOnDisk);

    Flux<BootResourceFile> findAll();

    Mono<BootResourceFile> save(BootResourceFile file);

    Mono<Void> deleteById(long id);
}
