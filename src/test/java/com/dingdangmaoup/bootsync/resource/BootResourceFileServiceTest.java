package com.dingdangmaoup.bootsync.resource;

import com.dingdangmaoup.bootsync.config.properties.StorageProperties;
import com.dingdangmaoup.bootsync.region.StaticRegionDiscovery;
import com.dingdangmaoup.bootsync.resource.repository.InMemoryBootResourceFileRepository;
import com.dingdangmaoup.bootsync.resource.repository.InMemoryFileSyncRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BootResourceFileServiceTest {

    private static final String SHA = "abcdef0123456789abcdef0123456789abcdef0123456789abcdef0123456789";
    private static final String OTHER_SHA = "abcdef0fffffffffffffffffffffffffffffffffffffffffffffffffffffffff";

    private final InMemoryBootResourceFileRepository fileRepository = new InMemoryBootResourceFileRepository();
    private final InMemoryFileSyncRepository syncRepository = new InMemoryFileSyncRepository();

    private StaticRegionDiscovery regions;
    private BootResourceFileService service;

    @BeforeEach
    void setUp() {
        regions = new StaticRegionDiscovery("region-1", "region-2");
        service = new BootResourceFileService(fileRepository, syncRepository, regions, new StorageProperties());
    }

    @Test
    void testCalculateFilenameOnDisk_unusedPrefix_returnsShortSha() {
        StepVerifier.create(service.calculateFilenameOnDisk(SHA))
                .expectNext("abcdef0")
                .verifyComplete();
    }

    @Test
    void testCalculateFilenameOnDisk_sameSha_reusesName() {
        saveFile(SHA, "abcdef0", 10);

        StepVerifier.create(service.calculateFilenameOnDisk(SHA))
                .expectNext("abcdef0")
                .verifyComplete();
    }

    @Test
    void testCalculateFilenameOnDisk_prefixTakenByOtherSha_widensName() {
        saveFile(OTHER_SHA, "abcdef0", 10);

        StepVerifier.create(service.calculateFilenameOnDisk(SHA))
                .expectNext("abcdef01")
                .verifyComplete();
    }

    @Test
    void testRecordProgress_severalFiles_recordsCurrentRegion() {
        BootResourceFile first = saveFile(SHA, "abcdef0", 10);
        BootResourceFile second = saveFile(SHA, "abcdef0", 10);

        service.recordProgress(List.of(first.getId(), second.getId()), 6).block();

        assertEquals(6L, syncRepository.syncedBytes(first.getId(), "region-1"));
        assertEquals(6L, syncRepository.syncedBytes(second.getId(), "region-1"));
        assertNull(syncRepository.syncedBytes(first.getId(), "region-2"));
    }

    @Test
    void testRegionsWithCompleteCopy_mixedProgress_listsCompleteRegionsSorted() {
        BootResourceFile file = saveFile(SHA, "abcdef0", 10);
        syncRepository.setSyncedBytes(file.getId(), "region-2", 10).block();
        syncRepository.setSyncedBytes(file.getId(), "region-1", 10).block();
        syncRepository.setSyncedBytes(file.getId(), "region-3", 4).block();

        StepVerifier.create(service.regionsWithCompleteCopy(file).collectList())
                .expectNext(List.of("region-1", "region-2"))
                .verifyComplete();
    }

    @Test
    void testIsSyncComplete_oneRegionMissing_returnsFalse() {
        BootResourceFile file = saveFile(SHA, "abcdef0", 10);
        syncRepository.setSyncedBytes(file.getId(), "region-1", 10).block();

        StepVerifier.create(service.isSyncComplete(file))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(service.isSyncCompleteOnRegion(file, "region-1"))
                .expectNext(true)
                .verifyComplete();

        syncRepository.setSyncedBytes(file.getId(), "region-2", 10).block();
        StepVerifier.create(service.isSyncComplete(file))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void testIsSyncComplete_copyOnlyOnRemovedRegion_returnsFalse() {
        BootResourceFile file = saveFile(SHA, "abcdef0", 10);
        syncRepository.setSyncedBytes(file.getId(), "region-1", 10).block();
        syncRepository.setSyncedBytes(file.getId(), "region-3", 10).block();
        regions.removeRegion("region-2");
        regions.addRegion("region-4");

        StepVerifier.create(service.isSyncComplete(file))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(service.regionsWithCompleteCopy(file).collectList())
                .expectNext(List.of("region-1"))
                .verifyComplete();
    }

    @Test
    void testGetById_unknownFile_failsWithNotFound() {
        StepVerifier.create(service.getById(7))
                .expectErrorMessage("Boot resource file 7 does not exist")
                .verify();
    }

    private BootResourceFile saveFile(String sha, String filenameOnDisk, long size) {
        return fileRepository.save(BootResourceFile.builder()
                .resourceSetId(1L)
                .filename("squashfs")
                .filetype(BootResourceFileType.SQUASHFS_IMAGE)
                .sha256(sha)
                .filenameOnDisk(filenameOnDisk)
                .size(size)
                .build()).block();
    }
}
