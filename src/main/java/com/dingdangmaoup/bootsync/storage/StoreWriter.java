package com.dingdangmaoup.bootsync.storage;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Appending handle of an open store operation.
 * <p>
 * The write that would take the file past its declared total size stores only the bytes
 * that fit, truncates the file to exactly the total size and raises
 * {@link LocalStoreFileSizeMismatchException}. Running out of disk space surfaces as
 * {@link LocalStoreAllocationFailException}; any other I/O error is rethrown unchanged.
 */
public class StoreWriter implements Closeable {

    private final LocalBootResourceFile file;
    private final OutputStream out;
    private long position;
    private boolean closed;

    StoreWriter(LocalBootResourceFile file, OutputStream out, long position) {
        this.file = file;
        this.out = out;
        this.position = position;
    }

    public void write(byte[] data) throws IOException {
        write(data, 0, data.length);
    }

    public void write(byte[] data, int offset, int length) throws IOException {
        if (closed) {
            throw new IllegalStateException("Store of " + file.getFilenameOnDisk() + " is already closed");
        }
        long remaining = Math.max(file.getTotalSize() - position, 0);
        int accepted = (int) Math.min(length, remaining);
        try {
            out.write(data, offset, accepted);
        } catch (IOException e) {
            LocalBootResourceFile.rethrowIfNoSpaceLeft(e);
            throw e;
        }
        position += accepted;

        if (accepted < length) {
            close();
            file.truncateToTotalSize();
            throw LocalStoreFileSizeMismatchException.tooMuchData();
        }
    }

    /**
     * Offset the next write lands at, i.e. the number of bytes of the file so far
     */
    public long position() {
        return position;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.close();
        } catch (IOException e) {
            LocalBootResourceFile.rethrowIfNoSpaceLeft(e);
            throw e;
        }
    }
}
