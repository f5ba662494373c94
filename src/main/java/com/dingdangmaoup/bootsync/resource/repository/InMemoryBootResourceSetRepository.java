package com.dingdangmaoup.bootsync.resource.repository;

import com.dingdangmaoup.bootsync.resource.BootResourceSet;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public class InMemoryBootResourceSetRepository extends InMemoryRepository<BootResourceSet>
        implements BootResourceSetRepository {

    public InMemoryBootResourceSetRepository() {
        super(BootResourceSet::getId, BootResourceSet::setId);
    }

    @Override
    public Flux<BootResourceSet> findByResourceIdNewestFirst(long resourceId) {
        return findWhereDescending(set -> set.getResourceId() != null && set.getResourceId() == resourceId);
    }
}
