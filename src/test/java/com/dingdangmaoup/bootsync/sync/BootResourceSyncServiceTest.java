package com.dingdangmaoup.bootsync.sync;

import com.dingdangmaoup.bootsync.resource.BootResourceFile;
import com.dingdangmaoup.bootsync.resource.BootResourceFileType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BootResourceSyncServiceTest {

    @TempDir
    Path root;

    @Mock
    private BootResourceDownloader downloader;

    private final List<ResourceDownloadParam> downloads = new CopyOnWriteArrayList<>();

    private BootResourceSyncService service(SyncFixture fixture) {
        return new BootResourceSyncService(
                new DiskSpaceChecker(fixture.imageStorage, fixture.regions),
                downloader,
                fixture.fileService,
                fixture.fileRepository,
                fixture.regions,
                fixture.distributedLock,
                fixture.imageStorage,
                fixture.syncProperties,
                fixture.syncMetrics);
    }

    private void downloadsSucceed(boolean result) {
        when(downloader.download(any())).thenAnswer(invocation -> {
            downloads.add(invocation.getArgument(0));
            return Mono.just(result);
        });
    }

    private static ResourceDownloadParam param(BootResourceFile file, String... sources) {
        return ResourceDownloadParam.builder()
                .fileIds(new ArrayList<>(List.of(file.getId())))
                .sourceList(new ArrayList<>(List.of(sources)))
                .sha256(file.getSha256())
                .filenameOnDisk(file.getFilenameOnDisk())
                .totalSize(file.getSize())
                .build();
    }

    @Test
    void testSync_upstreamResource_downloadedWithProxy() {
        SyncFixture fixture = new SyncFixture(root, "region-1");
        downloadsSucceed(true);
        BootResourceFile file = fixture.saveFile(1, SyncFixture.randomBytes(100, 1), BootResourceFileType.SQUASHFS_IMAGE);
        SyncRequest request = SyncRequest.builder()
                .resources(List.of(param(file, "http://images.example.com/squashfs")))
                .requirement(SpaceRequirement.minFreeSpace(1))
                .httpProxy("http://proxy.example.com:3128")
                .build();

        StepVerifier.create(service(fixture).sync(request))
                .verifyComplete();

        assertEquals(1, downloads.size());
        assertEquals("http://proxy.example.com:3128", downloads.get(0).getHttpProxy());
    }

    @Test
    void testSync_notEnoughSpace_aborts() {
        SyncFixture fixture = new SyncFixture(root, "region-1");
        BootResourceFile file = fixture.saveFile(1, SyncFixture.randomBytes(100, 2), BootResourceFileType.SQUASHFS_IMAGE);
        SyncRequest request = SyncRequest.builder()
                .resources(List.of(param(file, "http://images.example.com/squashfs")))
                .requirement(SpaceRequirement.minFreeSpace(Long.MAX_VALUE))
                .build();

        StepVerifier.create(service(fixture).sync(request))
                .expectErrorMatches(error -> error instanceof SyncException
                        && error.getMessage().equals("some region controllers don't have enough disk space"))
                .verify();

        verify(downloader, never()).download(any());
        assertEquals(1.0, fixture.meterRegistry.get("bootsync.sync.failures").counter().count());
    }

    @Test
    void testSync_upstreamDownloadFailed_aborts() {
        SyncFixture fixture = new SyncFixture(root, "region-1");
        downloadsSucceed(false);
        BootResourceFile file = fixture.saveFile(1, SyncFixture.randomBytes(100, 3), BootResourceFileType.SQUASHFS_IMAGE);
        SyncRequest request = SyncRequest.builder()
                .resources(List.of(param(file, "http://images.example.com/squashfs")))
                .build();

        StepVerifier.create(service(fixture).sync(request))
                .expectErrorMessage("some files could not be downloaded, aborting")
                .verify();
    }

    @Test
    void testSync_missingLocally_copiedFromRegionsWithCompleteCopy() {
        SyncFixture fixture = new SyncFixture(root, "region-1", "region-2", "region-3", "region-4");
        downloadsSucceed(true);
        BootResourceFile file = fixture.saveFile(1, SyncFixture.randomBytes(100, 4), BootResourceFileType.SQUASHFS_IMAGE);
        fixture.syncRepository.setSyncedBytes(file.getId(), "region-2", 100).block();
        fixture.syncRepository.setSyncedBytes(file.getId(), "region-3", 100).block();
        fixture.syncRepository.setSyncedBytes(file.getId(), "region-4", 50).block();

        StepVerifier.create(service(fixture).sync(SyncRequest.builder().resources(List.of(param(file))).build()))
                .verifyComplete();

        assertEquals(1, downloads.size());
        ResourceDownloadParam download = downloads.get(0);
        String path = "/MAAS/boot-resources/" + file.getFilenameOnDisk() + "/";
        assertEquals(Set.of("http://region-2.example.com:5240" + path, "http://region-3.example.com:5240" + path),
                Set.copyOf(download.getSourceList()));
        assertNull(download.getHttpProxy());
    }

    @Test
    void testSyncFromPeers_sourcesLimitedToMaxSources() {
        SyncFixture fixture = new SyncFixture(root, "region-1", "region-2", "region-3", "region-4");
        fixture.syncProperties.setMaxSources(2);
        downloadsSucceed(true);
        BootResourceFile file = fixture.saveFile(1, SyncFixture.randomBytes(100, 5), BootResourceFileType.SQUASHFS_IMAGE);
        for (String region : List.of("region-2", "region-3", "region-4")) {
            fixture.syncRepository.setSyncedBytes(file.getId(), region, 100).block();
        }

        StepVerifier.create(service(fixture).syncFromPeers(List.of(param(file))))
                .verifyComplete();

        assertEquals(2, downloads.get(0).getSourceList().size());
    }

    @Test
    void testSyncFromPeers_noCompleteCopy_skipped() {
        SyncFixture fixture = new SyncFixture(root, "region-1", "region-2");
        BootResourceFile file = fixture.saveFile(1, SyncFixture.randomBytes(100, 6), BootResourceFileType.SQUASHFS_IMAGE);
        fixture.syncRepository.setSyncedBytes(file.getId(), "region-2", 10).block();

        StepVerifier.create(service(fixture).syncFromPeers(List.of(param(file))))
                .verifyComplete();

        verify(downloader, never()).download(any());
    }

    @Test
    void testSyncFromPeers_completeLocally_nothingToDo() {
        SyncFixture fixture = new SyncFixture(root, "region-1", "region-2");
        BootResourceFile file = fixture.saveFile(1, SyncFixture.randomBytes(100, 7), BootResourceFileType.SQUASHFS_IMAGE);
        fixture.syncRepository.setSyncedBytes(file.getId(), "region-1", 100).block();

        StepVerifier.create(service(fixture).syncFromPeers(List.of(param(file))))
                .verifyComplete();

        verify(downloader, never()).download(any());
    }

    @Test
    void testSyncFromPeers_singleRegion_nothingToDo() {
        SyncFixture fixture = new SyncFixture(root, "region-1");
        BootResourceFile file = fixture.saveFile(1, SyncFixture.randomBytes(100, 8), BootResourceFileType.SQUASHFS_IMAGE);

        StepVerifier.create(service(fixture).syncFromPeers(List.of(param(file))))
                .verifyComplete();

        verify(downloader, never()).download(any());
    }

    @Test
    void testSyncFromPeers_peerDownloadFailed_aborts() {
        SyncFixture fixture = new SyncFixture(root, "region-1", "region-2");
        downloadsSucceed(false);
        BootResourceFile file = fixture.saveFile(1, SyncFixture.randomBytes(100, 9), BootResourceFileType.SQUASHFS_IMAGE);
        fixture.syncRepository.setSyncedBytes(file.getId(), "region-2", 100).block();

        StepVerifier.create(service(fixture).syncFromPeers(List.of(param(file))))
                .expectErrorMessage("some files could not be synced, aborting")
                .verify();
    }

    @Test
    void testDeleteFiles_unlinksStoredFiles() {
        SyncFixture fixture = new SyncFixture(root, "region-1");
        byte[] content = SyncFixture.randomBytes(100, 10);
        fixture.storeLocally(content);
        String sha = SyncFixture.sha256(content);

        StepVerifier.create(service(fixture).deleteFiles(List.of(
                        ResourceIdentifier.of(sha, sha.substring(0, 7)),
                        ResourceIdentifier.of("0".repeat(64), "0000000"))))
                .expectNext(true)
                .verifyComplete();

        assertFalse(Files.exists(root.resolve(sha.substring(0, 7))));
    }

    @Test
    void testRecordedResources_groupedBySha() {
        SyncFixture fixture = new SyncFixture(root, "region-1");
        byte[] kernel = SyncFixture.randomBytes(100, 11);
        BootResourceFile first = fixture.saveFile(1, kernel, BootResourceFileType.BOOT_KERNEL);
        BootResourceFile second = fixture.saveFile(2, kernel, BootResourceFileType.BOOT_KERNEL);
        fixture.saveFile(2, SyncFixture.randomBytes(100, 12), BootResourceFileType.BOOT_INITRD);

        StepVerifier.create(service(fixture).recordedResources())
                .assertNext(resources -> {
                    assertEquals(2, resources.size());
                    assertEquals(List.of(first.getId(), second.getId()), resources.get(0).getFileIds());
                    assertTrue(resources.stream().allMatch(resource -> resource.getSourceList().isEmpty()));
                    assertEquals(Set.of(100L), resources.stream()
                            .map(ResourceDownloadParam::getTotalSize)
                            .collect(Collectors.toSet()));
                })
                .verifyComplete();
    }
}
