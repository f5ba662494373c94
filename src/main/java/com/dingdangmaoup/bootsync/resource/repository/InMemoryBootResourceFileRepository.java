package com.dingdangmaoup.bootsync.resource.repository;

import com.dingdangmaoup.bootsync.resource.BootResourceFile;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public class InMemoryBootResourceFileRepository extends InMemoryRepository<BootResourceFile>
        implements BootResourceFileRepository {

    public InMemoryBootResourceFileRepository() {
        super(BootResourceFile::getId, BootResourceFile::setId);
    }

    @Override
    public Flux<BootResourceFile> findByResourceSetId(long resourceSetId) {
        return findWhere(file -> file.getResourceSetId() != null && file.getResourceSetId() == resourceSetId);
    }

    @Override
    public Flux<BootResourceFile> findByFilenameOnDisk(String filenameOnDisk) {
        return findWhere(file -> filenameOnDisk.equals(file.getFilenameOnDisk()));
    }
}
