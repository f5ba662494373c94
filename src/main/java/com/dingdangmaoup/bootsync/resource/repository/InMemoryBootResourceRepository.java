package com.dingdangmaoup.bootsync.resource.repository;

import com.dingdangmaoup.bootsync.resource.BootResource;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryBootResourceRepository extends InMemoryRepository<BootResource>
        implements BootResourceRepository {

    public InMemoryBootResourceRepository() {
        super(BootResource::getId, BootResource::setId);
    }
}
