package com.dingdangmaoup.bootsync.sync;

import com.dingdangmaoup.bootsync.config.properties.StorageProperties;
import com.dingdangmaoup.bootsync.config.properties.SyncProperties;
import com.dingdangmaoup.bootsync.coordination.DistributedLock;
import com.dingdangmaoup.bootsync.metrics.SyncMetrics;
import com.dingdangmaoup.bootsync.region.StaticRegionDiscovery;
import com.dingdangmaoup.bootsync.resource.BootResourceFile;
import com.dingdangmaoup.bootsync.resource.BootResourceFileService;
import com.dingdangmaoup.bootsync.resource.BootResourceFileType;
import com.dingdangmaoup.bootsync.resource.repository.BootResourceFileRepository;
import com.dingdangmaoup.bootsync.resource.repository.InMemoryBootResourceFileRepository;
import com.dingdangmaoup.bootsync.resource.repository.InMemoryFileSyncRepository;
import com.dingdangmaoup.bootsync.storage.FileSystemImageStoreIo;
import com.dingdangmaoup.bootsync.storage.FilenameOnDisk;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import com.dingdangmaoup.bootsync.storage.ImageStoreIo;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Random;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.lenient;

/**
 * Services of the sync package wired on in-memory repositories and a temporary store
 */
class SyncFixture {

    final Path root;
    final ImageStorage imageStorage;
    final BootResourceFileRepository fileRepository = new InMemoryBootResourceFileRepository();
    final InMemoryFileSyncRepository syncRepository = new InMemoryFileSyncRepository();
    final StaticRegionDiscovery regions;
    final BootResourceFileService fileService;
    final SyncProperties syncProperties = new SyncProperties();
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final SyncMetrics syncMetrics;
    final DistributedLock distributedLock;

    SyncFixture(Path root, String currentRegion, String... otherRegions) {
        this(root, new FileSystemImageStoreIo(), currentRegion, otherRegions);
    }

    SyncFixture(Path root, ImageStoreIo io, String currentRegion, String... otherRegions) {
        this.root = root;
        this.imageStorage = new ImageStorage(root, io);
        this.regions = new StaticRegionDiscovery(currentRegion, otherRegions);
        this.fileService = new BootResourceFileService(fileRepository, syncRepository, regions, new StorageProperties());
        this.syncMetrics = new SyncMetrics(meterRegistry, imageStorage);
        this.distributedLock = passThroughLock();
        syncProperties.setRetryBackoff(Duration.ofMillis(1));
        syncProperties.setMaxRetryBackoff(Duration.ofMillis(5));
        syncProperties.setDownloadTimeout(Duration.ofSeconds(10));
    }

    static DistributedLock passThroughLock() {
        DistributedLock lock = mock(DistributedLock.class);
        lenient().when(lock.withLock(anyString(), any())).thenAnswer(invocation -> invocation.getArgument(1));
        return lock;
    }

    BootResourceFile saveFile(long resourceSetId, byte[] content, BootResourceFileType type) {
        String sha = sha256(content);
        return fileRepository.save(BootResourceFile.builder()
                .resourceSetId(resourceSetId)
                .filename(type.getValue())
                .filetype(type)
                .sha256(sha)
                .filenameOnDisk(FilenameOnDisk.shortSha(sha))
                .size(content.length)
                .build()).block();
    }

    void storeLocally(byte[] content) {
        try {
            Files.createDirectories(root);
            Files.write(root.resolve(FilenameOnDisk.shortSha(sha256(content))), content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static byte[] randomBytes(int length, long seed) {
        byte[] bytes = new byte[length];
        new Random(seed).nextBytes(bytes);
        return bytes;
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
