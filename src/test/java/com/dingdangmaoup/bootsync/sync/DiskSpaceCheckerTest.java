package com.dingdangmaoup.bootsync.sync;

import com.dingdangmaoup.bootsync.region.StaticRegionDiscovery;
import com.dingdangmaoup.bootsync.storage.FileSystemImageStoreIo;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DiskSpaceCheckerTest {

    @TempDir
    Path root;

    private DiskSpaceChecker checker(long freeSpace) {
        FileSystemImageStoreIo io = new FileSystemImageStoreIo() {
            @Override
            public long usableSpace(Path directory) {
                return freeSpace;
            }
        };
        return new DiskSpaceChecker(new ImageStorage(root, io), new StaticRegionDiscovery("region-1"));
    }

    @Test
    void testCheckDiskSpace_enoughFreeSpace() {
        StepVerifier.create(checker(2_000).checkDiskSpace(SpaceRequirement.minFreeSpace(1_000)))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void testCheckDiskSpace_freeSpaceMustExceedRequirement() {
        StepVerifier.create(checker(1_000).checkDiskSpace(SpaceRequirement.minFreeSpace(1_000)))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void testCheckDiskSpace_totalResourcesSize_countsStoredBytes() throws IOException {
        Files.write(root.resolve("abcdef0"), new byte[600]);
        Files.createDirectories(root.resolve("bootloaders/uefi/amd64"));
        Files.write(root.resolve("bootloaders/uefi/amd64/grubx64.efi"), new byte[300]);

        StepVerifier.create(checker(200).checkDiskSpace(SpaceRequirement.totalResourcesSize(1_000)))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(checker(200).checkDiskSpace(SpaceRequirement.minFreeSpace(1_000)))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void testSpaceRequirement_bothModes_rejected() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> SpaceRequirement.of(1L, 2L));
        assertEquals("Only one of 'min_free_space' and 'total_resources_size' can be specified.", error.getMessage());
    }

    @Test
    void testHumanReadable() {
        assertEquals("512 bytes", DiskSpaceChecker.humanReadable(512));
        assertEquals("1.5 KiB", DiskSpaceChecker.humanReadable(1536));
        assertEquals("2.0 GiB", DiskSpaceChecker.humanReadable(2L * 1024 * 1024 * 1024));
    }
}
