package com.dingdangmaoup.bootsync.sync;

import com.dingdangmaoup.bootsync.resource.BootResourceFile;
import com.dingdangmaoup.bootsync.resource.BootResourceFileType;
import com.dingdangmaoup.bootsync.simplestreams.DownloadAuthenticator;
import com.dingdangmaoup.bootsync.storage.FileSystemImageStoreIo;
import com.dingdangmaoup.bootsync.storage.LocalStoreInvalidHashException;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRange;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class BootResourceDownloaderTest {

    private static final String MIRROR = "http://images.example.com/";
    private static final String OTHER_MIRROR = "http://mirror.example.com/";

    @TempDir
    Path root;

    private final Map<String, byte[]> served = new ConcurrentHashMap<>();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private SyncFixture fixture;
    private BootResourceDownloader downloader;

    @BeforeEach
    void setUp() {
        fixture = new SyncFixture(root, "region-1");
        downloader = downloader(fixture, DownloadAuthenticator.NONE);
    }

    private BootResourceDownloader downloader(SyncFixture fixture, DownloadAuthenticator authenticator) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    byte[] content = served.get(request.url().toString());
                    if (content == null) {
                        return Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
                    }
                    HttpStatus status = HttpStatus.OK;
                    List<HttpRange> ranges = request.headers().getRange();
                    if (!ranges.isEmpty()) {
                        int start = (int) ranges.get(0).getRangeStart(content.length);
                        content = Arrays.copyOfRange(content, start, content.length);
                        status = HttpStatus.PARTIAL_CONTENT;
                    }
                    return Mono.just(ClientResponse.create(status).body(chunks(content)).build());
                })
                .build();
        return new BootResourceDownloader(webClient, authenticator, fixture.distributedLock, fixture.imageStorage,
                fixture.fileService, fixture.syncProperties, fixture.syncMetrics);
    }

    private static Flux<DataBuffer> chunks(byte[] content) {
        List<DataBuffer> buffers = new ArrayList<>();
        for (int offset = 0; offset < content.length; offset += 1000) {
            byte[] chunk = Arrays.copyOfRange(content, offset, Math.min(content.length, offset + 1000));
            buffers.add(DefaultDataBufferFactory.sharedInstance.wrap(chunk));
        }
        return Flux.fromIterable(buffers);
    }

    private ResourceDownloadParam param(BootResourceFile file, String... sources) {
        return ResourceDownloadParam.builder()
                .fileIds(new ArrayList<>(List.of(file.getId())))
                .sourceList(new ArrayList<>(List.of(sources)))
                .sha256(file.getSha256())
                .filenameOnDisk(file.getFilenameOnDisk())
                .totalSize(file.getSize())
                .build();
    }

    private Path stored(BootResourceFile file) {
        return root.resolve(file.getFilenameOnDisk());
    }

    @Test
    void testDownloadAttempt_storesFileAndReportsTotalSize() throws IOException {
        byte[] content = SyncFixture.randomBytes(10_000, 1);
        BootResourceFile file = fixture.saveFile(1, content, BootResourceFileType.SQUASHFS_IMAGE);
        served.put(MIRROR + "squashfs", content);

        StepVerifier.create(downloader.downloadAttempt(param(file, MIRROR + "squashfs"), 0))
                .expectNext(true)
                .verifyComplete();

        assertArrayEquals(content, Files.readAllBytes(stored(file)));
        assertEquals(10_000L, fixture.syncRepository.syncedBytes(file.getId(), "region-1"));
        assertEquals(1.0, fixture.meterRegistry.get("bootsync.download.files").counter().count());
    }

    @Test
    void testDownloadAttempt_alreadyValid_skipsRequest() {
        byte[] content = SyncFixture.randomBytes(2_000, 2);
        BootResourceFile file = fixture.saveFile(1, content, BootResourceFileType.BOOT_KERNEL);
        fixture.storeLocally(content);

        StepVerifier.create(downloader.downloadAttempt(param(file, MIRROR + "boot-kernel"), 0))
                .expectNext(true)
                .verifyComplete();

        assertTrue(requests.isEmpty());
        assertEquals(2_000L, fixture.syncRepository.syncedBytes(file.getId(), "region-1"));
        assertEquals(1.0, fixture.meterRegistry.get("bootsync.download.skipped").counter().count());
    }

    @Test
    void testDownloadAttempt_attemptNumber_rotatesSources() {
        byte[] content = SyncFixture.randomBytes(3_000, 3);
        BootResourceFile file = fixture.saveFile(1, content, BootResourceFileType.BOOT_INITRD);
        served.put(OTHER_MIRROR + "boot-initrd", content);

        StepVerifier.create(downloader.downloadAttempt(param(file, MIRROR + "boot-initrd", OTHER_MIRROR + "boot-initrd"), 3))
                .expectNext(true)
                .verifyComplete();

        assertEquals(OTHER_MIRROR + "boot-initrd", requests.get(0).url().toString());
    }

    @Test
    void testDownloadAttempt_invalidContent_deletesFileAndReportsZero() {
        byte[] content = SyncFixture.randomBytes(5_000, 4);
        BootResourceFile file = fixture.saveFile(1, content, BootResourceFileType.SQUASHFS_IMAGE);
        byte[] corrupted = content.clone();
        corrupted[100] ^= 0x1;
        served.put(MIRROR + "squashfs", corrupted);

        StepVerifier.create(downloader.downloadAttempt(param(file, MIRROR + "squashfs"), 0))
                .expectError(LocalStoreInvalidHashException.class)
                .verify();

        assertFalse(Files.exists(stored(file)));
        assertEquals(0L, fixture.syncRepository.syncedBytes(file.getId(), "region-1"));
    }

    @Test
    void testDownloadAttempt_noSpaceLeft_returnsFalse() {
        FileSystemImageStoreIo fullDisk = new FileSystemImageStoreIo() {
            @Override
            public long usableSpace(Path directory) {
                return 0;
            }
        };
        SyncFixture full = new SyncFixture(root, fullDisk, "region-1");
        BootResourceDownloader fullDownloader = downloader(full, DownloadAuthenticator.NONE);
        byte[] content = SyncFixture.randomBytes(5_000, 5);
        BootResourceFile file = full.saveFile(1, content, BootResourceFileType.SQUASHFS_IMAGE);
        served.put(MIRROR + "squashfs", content);

        StepVerifier.create(fullDownloader.downloadAttempt(param(file, MIRROR + "squashfs"), 0))
                .expectNext(false)
                .verifyComplete();

        assertFalse(Files.exists(stored(file)));
        assertEquals(0L, full.syncRepository.syncedBytes(file.getId(), "region-1"));
    }

    @Test
    void testDownloadAttempt_partialFile_resumesWithRange() throws IOException {
        byte[] content = SyncFixture.randomBytes(8_000, 6);
        BootResourceFile file = fixture.saveFile(1, content, BootResourceFileType.SQUASHFS_IMAGE);
        Files.write(stored(file), Arrays.copyOf(content, 3_000));
        served.put(MIRROR + "squashfs", content);

        StepVerifier.create(downloader.downloadAttempt(param(file, MIRROR + "squashfs"), 0))
                .expectNext(true)
                .verifyComplete();

        assertEquals(List.of(HttpRange.createByteRange(3_000)), requests.get(0).headers().getRange());
        assertArrayEquals(content, Files.readAllBytes(stored(file)));
    }

    @Test
    void testDownloadAttempt_reportsProgressWhileStreaming() {
        fixture.syncProperties.setReportInterval(Duration.ZERO);
        byte[] content = SyncFixture.randomBytes(4_000, 7);
        BootResourceFile file = fixture.saveFile(1, content, BootResourceFileType.SQUASHFS_IMAGE);
        served.put(MIRROR + "squashfs", content);

        StepVerifier.create(downloader.downloadAttempt(param(file, MIRROR + "squashfs"), 0))
                .expectNext(true)
                .verifyComplete();

        assertEquals(List.of(0L, 1_000L, 2_000L, 3_000L, 4_000L), fixture.syncRepository.reportedSizes());
    }

    @Test
    void testDownloadAttempt_authenticatorSuppliesHeader() {
        BootResourceDownloader authenticated = downloader(fixture, uri -> Mono.just("Macaroon root=abc"));
        byte[] content = SyncFixture.randomBytes(1_000, 8);
        BootResourceFile file = fixture.saveFile(1, content, BootResourceFileType.BOOT_KERNEL);
        served.put(MIRROR + "boot-kernel", content);

        StepVerifier.create(authenticated.downloadAttempt(param(file, MIRROR + "boot-kernel"), 0))
                .expectNext(true)
                .verifyComplete();

        assertEquals("Macaroon root=abc", requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testDownloadAttempt_extractsArchive() throws IOException {
        byte[] archive = tar("grubx64.efi", "bootloader");
        BootResourceFile file = fixture.saveFile(1, archive, BootResourceFileType.ARCHIVE_TAR_XZ);
        served.put(MIRROR + "grub.tar", archive);
        ResourceDownloadParam param = param(file, MIRROR + "grub.tar");
        param.getExtractPaths().add("bootloaders/uefi/amd64");

        StepVerifier.create(downloader.downloadAttempt(param, 0))
                .expectNext(true)
                .verifyComplete();

        assertEquals("bootloader",
                Files.readString(root.resolve("bootloaders/uefi/amd64/grubx64.efi"), StandardCharsets.UTF_8));
    }

    @Test
    void testDownload_failingSource_retriesWithNextSource() {
        byte[] content = SyncFixture.randomBytes(2_500, 9);
        BootResourceFile file = fixture.saveFile(1, content, BootResourceFileType.SQUASHFS_IMAGE);
        served.put(OTHER_MIRROR + "squashfs", content);

        StepVerifier.create(downloader.download(param(file, MIRROR + "squashfs", OTHER_MIRROR + "squashfs")))
                .expectNext(true)
                .verifyComplete();

        assertEquals(2, requests.size());
        assertEquals(1.0, fixture.meterRegistry.get("bootsync.download.failures").counter().count());
    }

    @Test
    void testDownload_noSources_fails() {
        byte[] content = SyncFixture.randomBytes(100, 10);
        BootResourceFile file = fixture.saveFile(1, content, BootResourceFileType.SQUASHFS_IMAGE);

        StepVerifier.create(downloader.download(param(file)))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    private static byte[] tar(String name, String text) throws IOException {
        byte[] data = text.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
            TarArchiveEntry entry = new TarArchiveEntry(name);
            entry.setSize(data.length);
            tar.putArchiveEntry(entry);
            tar.write(data);
            tar.closeArchiveEntry();
        }
        return out.toByteArray();
    }
}
