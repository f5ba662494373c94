package com.dingdangmaoup.bootsync.resource.repository;

import com.dingdangmaoup.bootsync.resource.BootResource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface BootResourceRepository {

    Mono<BootResource> findById(long id);

    Flux<BootResource> findAll();

    Mono<BootResource> save(BootResource resource);

    Mono<Void> deleteById(long id);
}
