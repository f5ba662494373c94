package com.dingdangmaoup.bootsync.storage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileSystemException;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One boot resource file stored under its filename-on-disk in the image storage.
 * <p>
 * Size, completeness and validity are always recomputed from the bytes on disk, so an
 * interrupted store leaves a file that can be resumed by storing the remaining bytes.
 * Concurrent writers to the same filename are not guarded against here; callers hold
 * the per-file lock.
 */
@Slf4j
@Getter
public class LocalBootResourceFile {

    private static final String NO_SPACE_LEFT = "No space left on device";
    private static final int READ_BUFFER_SIZE = 1024 * 1024;

    private final String sha256;
    private final String filenameOnDisk;
    private final long totalSize;
    private final Path path;

    @Getter(lombok.AccessLevel.NONE)
    private final Path storeRoot;

    @Getter(lombok.AccessLevel.NONE)
    private final ImageStoreIo io;

    public LocalBootResourceFile(Path storeRoot, ImageStoreIo io, String sha256, String filenameOnDisk,
                                 long totalSize) {
        if (filenameOnDisk == null || filenameOnDisk.isEmpty()
                || !sha256.toLowerCase().startsWith(filenameOnDisk.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Filename on disk '" + filenameOnDisk + "' is not a prefix of " + sha256);
        }
        if (totalSize < 0) {
            throw new IllegalArgumentException("Negative total size: " + totalSize);
        }
        this.storeRoot = storeRoot;
        this.io = io;
        this.sha256 = sha256;
        this.filenameOnDisk = filenameOnDisk;
        this.totalSize = totalSize;
        this.path = storeRoot.resolve(filenameOnDisk);
    }

    /**
     * Bytes currently on disk, 0 if the file does not exist
     */
    public long size() {
        try {
            return io.size(path);
        } catch (IOException e) {
            throw new StorageException("Failed to read size of " + path, e);
        }
    }

    public boolean complete() {
        return size() == totalSize;
    }

    /**
     * Whether the file is complete and its content hashes to the declared sha256
     */
    public boolean valid() {
        if (!complete()) {
            return false;
        }
        return sha256.equalsIgnoreCase(computeSha256());
    }

    public void unlink() {
        try {
            if (io.deleteIfExists(path)) {
                log.debug("Deleted boot resource file {}", filenameOnDisk);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + path, e);
        }
    }

    /**
     * Run a write scope on the file, appending at its current end.
     * <p>
     * Raises {@link LocalStoreAllocationFailException} before touching the file when the
     * filesystem cannot hold the missing bytes. When the scope ends the file must be complete
     * and valid, otherwise it is deleted and {@link LocalStoreFileSizeMismatchException} or
     * {@link LocalStoreInvalidHashException} is raised.
     *
     * @param action writes the content
     */
    public void store(StoreAction action) throws IOException {
        StoreWriter writer = openStore();
        try (writer) {
            action.write(writer);
        } catch (LocalStoreFileSizeMismatchException e) {
            unlink();
            throw e;
        }
        commitStore();
    }

    /**
     * First half of {@link #store(StoreAction)}: space preflight and open for append.
     */
    public StoreWriter openStore() {
        long sizeOnEntry = size();
        ensureSpaceFor(totalSize - sizeOnEntry);
        try {
            io.createDirectories(storeRoot);
            return new StoreWriter(this, io.openAppend(path), sizeOnEntry);
        } catch (IOException e) {
            rethrowIfNoSpaceLeft(e);
            throw new StorageException("Failed to open " + path + " for writing", e);
        }
    }

    /**
     * Second half of {@link #store(StoreAction)}, run once the writer is closed.
     */
    public void commitStore() {
        truncateToTotalSize();
        if (!complete()) {
            unlink();
            throw LocalStoreFileSizeMismatchException.sizeMismatch();
        }
        if (!valid()) {
            unlink();
            throw new LocalStoreInvalidHashException();
        }
        log.info("Stored boot resource file {} ({} bytes)", filenameOnDisk, totalSize);
    }

    /**
     * Append one chunk of an incremental upload.
     *
     * @param data bytes to append
     * @throws LocalStoreFileSizeMismatchException if the chunk goes past the total size;
     *         the file is left at exactly the total size
     * @throws LocalStoreAllocationFailException if the disk is full
     * @throws IOException any other write failure
     */
    public void appendChunk(byte[] data) throws IOException {
        long current = size();
        OutputStream out;
        try {
            io.createDirectories(storeRoot);
            out = io.openAppend(path);
        } catch (IOException e) {
            rethrowIfNoSpaceLeft(e);
            throw e;
        }
        try (StoreWriter writer = new StoreWriter(this, out, current)) {
            writer.write(data);
        }
    }

    /**
     * Extract the file, a tar archive optionally compressed with gzip or xz, into a
     * sub-directory of the image storage. The content is not checked against the sha256.
     *
     * @param targetSubdirectory directory relative to the storage root
     * @return the directory the archive was extracted into
     */
    public Path extractFile(String targetSubdirectory) throws IOException {
        Path target = storeRoot.resolve(targetSubdirectory).normalize();
        if (!target.startsWith(storeRoot.normalize())) {
            throw new IllegalArgumentException("Extraction target outside of image storage: " + targetSubdirectory);
        }
        io.createDirectories(target);
        try (InputStream in = io.openRead(path)) {
            int entries = ArchiveExtractor.extractTar(in, target);
            log.info("Extracted {} entries of {} into {}", entries, filenameOnDisk, target);
        }
        return target;
    }

    void truncateToTotalSize() {
        try {
            io.truncate(path, totalSize);
        } catch (IOException e) {
            throw new StorageException("Failed to truncate " + path, e);
        }
    }

    private void ensureSpaceFor(long bytes) {
        if (bytes <= 0) {
            return;
        }
        long usable;
        try {
            usable = io.usableSpace(storeRoot);
        } catch (IOException e) {
            throw new StorageException("Failed to read free space of " + storeRoot, e);
        }
        if (usable < bytes) {
            log.warn("Not enough space to store {}: {} bytes needed, {} available",
                    filenameOnDisk, bytes, usable);
            throw new LocalStoreAllocationFailException();
        }
    }

    private String computeSha256() {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = new DigestInputStream(io.openRead(path), digest)) {
            byte[] buffer = new byte[READ_BUFFER_SIZE];
            while (in.read(buffer) != -1) {
                // digest is updated by the stream
            }
        } catch (IOException e) {
            throw new StorageException("Failed to read " + path, e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    static void rethrowIfNoSpaceLeft(IOException e) {
        String reason = e instanceof FileSystemException fse ? fse.getReason() : e.getMessage();
        if (reason != null && reason.contains(NO_SPACE_LEFT)) {
            throw new LocalStoreAllocationFailException(e);
        }
    }

    @Override
    public String toString() {
        return String.format("LocalBootResourceFile[%s, sha256=%s, totalSize=%d]",
                filenameOnDisk, sha256, totalSize);
    }
}
