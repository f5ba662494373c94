package com.dingdangmaoup.bootsync.storage;

/**
 * Not enough space on the filesystem holding the image storage.
 */
public class LocalStoreAllocationFailException extends LocalStoreException {

    public static final String MESSAGE = "No space left on device";

    public LocalStoreAllocationFailException() {
        super(MESSAGE);
    }

    public LocalStoreAllocationFailException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
