package com.dingdangmaoup.bootsync.resource.repository;

import com.dingdangmaoup.bootsync.resource.BootResourceSet;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface BootResourceSetRepository {

    Mono<BootResourceSet> findById(long id);

    /**
     * Sets of a resource, newest (highest id) first
     */
    Flux<BootResourceSet> findByResourceIdNewestFirst(long resourceId);

    Mono<BootResourceSet> save(BootResourceSet set);

    Mono<Void> deleteById(long id);
}
