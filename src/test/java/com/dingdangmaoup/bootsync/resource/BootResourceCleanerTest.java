package com.dingdangmaoup.bootsync.resource;

import com.dingdangmaoup.bootsync.region.StaticRegionDiscovery;
import com.dingdangmaoup.bootsync.resource.repository.InMemoryBootResourceFileRepository;
import com.dingdangmaoup.bootsync.resource.repository.InMemoryBootResourceRepository;
import com.dingdangmaoup.bootsync.resource.repository.InMemoryBootResourceSetRepository;
import com.dingdangmaoup.bootsync.resource.repository.InMemoryFileSyncRepository;
import com.dingdangmaoup.bootsync.storage.FileSystemImageStoreIo;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BootResourceCleanerTest {

    @TempDir
    Path root;

    private final InMemoryBootResourceRepository resourceRepository = new InMemoryBootResourceRepository();
    private final InMemoryBootResourceSetRepository setRepository = new InMemoryBootResourceSetRepository();
    private final InMemoryBootResourceFileRepository fileRepository = new InMemoryBootResourceFileRepository();
    private final InMemoryFileSyncRepository syncRepository = new InMemoryFileSyncRepository();

    private BootResourceCleaner cleaner;

    @BeforeEach
    void setUp() {
        StaticRegionDiscovery regions = new StaticRegionDiscovery("region-1");
        BootResourceSetService setService = new BootResourceSetService(resourceRepository, setRepository,
                fileRepository, syncRepository, regions);
        cleaner = new BootResourceCleaner(resourceRepository, setRepository, fileRepository, syncRepository,
                setService, new ImageStorage(root, new FileSystemImageStoreIo()));
    }

    @Test
    void testDeleteOldSets_twoCompleteSets_keepsNewestOnly() throws IOException {
        BootResource resource = saveResource("ubuntu/jammy", BootResource.BootResourceType.SYNCED);
        BootResourceSet older = saveSet(resource, "20240101");
        BootResourceSet newer = saveSet(resource, "20240201");
        BootResourceFile oldKernel = saveFile(older, "aaaaaaa", true);
        BootResourceFile newKernel = saveFile(newer, "bbbbbbb", true);

        List<BootResourceFile> removed = cleaner.deleteOldBootResourceSets().block();

        assertEquals(List.of(oldKernel.getId()), removed.stream().map(BootResourceFile::getId).toList());
        assertNull(setRepository.findById(older.getId()).block());
        assertNotNull(setRepository.findById(newer.getId()).block());
        assertFalse(Files.exists(root.resolve("aaaaaaa")));
        assertTrue(Files.exists(root.resolve("bbbbbbb")));
        assertNull(syncRepository.syncedBytes(oldKernel.getId(), "region-1"));
        assertNotNull(fileRepository.findById(newKernel.getId()).block());
    }

    @Test
    void testDeleteOldSets_newestIncomplete_deletesIncompleteAndOlderComplete() throws IOException {
        BootResource resource = saveResource("ubuntu/jammy", BootResource.BootResourceType.SYNCED);
        BootResourceSet oldest = saveSet(resource, "20240101");
        BootResourceSet complete = saveSet(resource, "20240201");
        BootResourceSet incomplete = saveSet(resource, "20240301");
        saveFile(oldest, "aaaaaaa", true);
        saveFile(complete, "bbbbbbb", true);
        saveFile(incomplete, "ccccccc", false);

        List<BootResourceFile> removed = cleaner.deleteOldBootResourceSets().block();

        assertEquals(2, removed.size());
        assertNull(setRepository.findById(oldest.getId()).block());
        assertNotNull(setRepository.findById(complete.getId()).block());
        assertNull(setRepository.findById(incomplete.getId()).block());
    }

    @Test
    void testDeleteOldSets_noCompleteSet_deletesResource() throws IOException {
        BootResource resource = saveResource("ubuntu/focal", BootResource.BootResourceType.SYNCED);
        BootResourceSet set = saveSet(resource, "20240101");
        saveFile(set, "aaaaaaa", false);

        cleaner.deleteOldBootResourceSets().block();

        assertNull(setRepository.findById(set.getId()).block());
        assertNull(resourceRepository.findById(resource.getId()).block());
    }

    @Test
    void testDeleteOldSets_sharedFilenameOnDisk_keepsLocalFile() throws IOException {
        BootResource jammy = saveResource("ubuntu/jammy", BootResource.BootResourceType.SYNCED);
        BootResource other = saveResource("ubuntu/jammy-hwe", BootResource.BootResourceType.SYNCED);
        BootResourceSet older = saveSet(jammy, "20240101");
        saveSet(jammy, "20240201");
        saveFile(setRepository.findByResourceIdNewestFirst(jammy.getId()).blockFirst(), "bbbbbbb", true);
        saveFile(older, "aaaaaaa", true);
        saveFile(saveSet(other, "20240101"), "aaaaaaa", true);

        cleaner.deleteOldBootResourceSets().block();

        assertNull(setRepository.findById(older.getId()).block());
        assertTrue(Files.exists(root.resolve("aaaaaaa")));
    }

    @Test
    void testDeleteOldSets_uploadedResource_untouched() throws IOException {
        BootResource uploaded = saveResource("custom/image", BootResource.BootResourceType.UPLOADED);
        BootResourceSet older = saveSet(uploaded, "1");
        saveSet(uploaded, "2");
        saveFile(older, "aaaaaaa", true);

        List<BootResourceFile> removed = cleaner.deleteOldBootResourceSets().block();

        assertTrue(removed.isEmpty());
        assertNotNull(setRepository.findById(older.getId()).block());
    }

    private BootResource saveResource(String name, BootResource.BootResourceType type) {
        return resourceRepository.save(BootResource.builder()
                .rtype(type)
                .name(name)
                .architecture("amd64/generic")
                .build()).block();
    }

    private BootResourceSet saveSet(BootResource resource, String version) {
        return setRepository.save(BootResourceSet.builder()
                .resourceId(resource.getId())
                .version(version)
                .label("stable")
                .build()).block();
    }

    private BootResourceFile saveFile(BootResourceSet set, String filenameOnDisk, boolean synced) throws IOException {
        BootResourceFile file = fileRepository.save(BootResourceFile.builder()
                .resourceSetId(set.getId())
                .filename("boot-kernel")
                .filetype(BootResourceFileType.BOOT_KERNEL)
                .sha256(filenameOnDisk + "0".repeat(57))
                .filenameOnDisk(filenameOnDisk)
                .size(4)
                .build()).block();
        Files.write(root.resolve(filenameOnDisk), new byte[]{1, 2, 3, 4});
        syncRepository.setSyncedBytes(file.getId(), "region-1", synced ? 4 : 1).block();
        return file;
    }
}
