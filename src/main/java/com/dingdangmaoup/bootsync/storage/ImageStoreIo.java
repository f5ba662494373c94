package com.dingdangmaoup.bootsync.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Disk operations the image store relies on. Every call is a blocking I/O boundary.
 */
public interface ImageStoreIo {

    /**
     * Size of the file in bytes
     *
     * @param path file path
     * @return current size, or 0 if the file does not exist
     */
    long size(Path path) throws IOException;

    /**
     * Bytes available to this process on the filesystem containing the directory
     *
     * @param directory any directory on the filesystem
     * @return usable space in bytes
     */
    long usableSpace(Path directory) throws IOException;

    /**
     * Open the file for writing at its end, creating it if absent
     *
     * @param path file path
     * @return stream positioned at the current end of file
     */
    OutputStream openAppend(Path path) throws IOException;

    /**
     * Open the file for reading from the start
     */
    InputStream openRead(Path path) throws IOException;

    /**
     * Cut the file down to the given size. No-op if it is already smaller or absent.
     */
    void truncate(Path path, long size) throws IOException;

    /**
     * Delete the file
     *
     * @return true if a file was deleted
     */
    boolean deleteIfExists(Path path) throws IOException;

    /**
     * Create the directory and its parents with default permissions
     */
    void createDirectories(Path directory) throws IOException;
}
