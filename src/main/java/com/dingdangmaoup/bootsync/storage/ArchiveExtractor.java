package com.dingdangmaoup.bootsync.storage;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Tar extraction with transparent gzip / xz decompression.
 */
final class ArchiveExtractor {

    private static final int SIGNATURE_LENGTH = 6;

    private ArchiveExtractor() {
    }

    /**
     * @return number of archive entries written
     */
    static int extractTar(InputStream raw, Path target) throws IOException {
        Path root = target.normalize();
        int count = 0;
        try (TarArchiveInputStream tar = new TarArchiveInputStream(decompressing(new BufferedInputStream(raw)))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                Path destination = resolveInside(root, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                } else if (entry.isSymbolicLink()) {
                    Files.createDirectories(destination.getParent());
                    Files.deleteIfExists(destination);
                    Files.createSymbolicLink(destination, Path.of(entry.getLinkName()));
                } else if (entry.isLink()) {
                    Files.createDirectories(destination.getParent());
                    Files.deleteIfExists(destination);
                    Files.createLink(destination, resolveInside(root, entry.getLinkName()));
                } else {
                    Files.createDirectories(destination.getParent());
                    Files.copy(tar, destination, StandardCopyOption.REPLACE_EXISTING);
                }
                count++;
            }
        }
        return count;
    }

    private static Path resolveInside(Path root, String name) throws IOException {
        Path destination = root.resolve(name).normalize();
        if (!destination.startsWith(root)) {
            throw new IOException("Archive entry outside of target directory: " + name);
        }
        return destination;
    }

    private static InputStream decompressing(BufferedInputStream in) throws IOException {
        byte[] signature = new byte[SIGNATURE_LENGTH];
        in.mark(SIGNATURE_LENGTH);
        int read = in.readNBytes(signature, 0, SIGNATURE_LENGTH);
        in.reset();

        if (GzipCompressorInputStream.matches(signature, read)) {
            return new GzipCompressorInputStream(in);
        }
        if (XZCompressorInputStream.matches(signature, read)) {
            return new XZCompressorInputStream(in);
        }
        return in;
    }
}
