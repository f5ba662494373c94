package com.dingdangmaoup.bootsync.storage;

/**
 * The amount of data written does not match the declared total size.
 */
public class LocalStoreFileSizeMismatchException extends LocalStoreException {

    public static final String TOO_MUCH_DATA = "Too much data received";
    public static final String SIZE_MISMATCH = "Content-Length doesn't equal size of received data";

    public LocalStoreFileSizeMismatchException(String message) {
        super(message);
    }

    public static LocalStoreFileSizeMismatchException tooMuchData() {
        return new LocalStoreFileSizeMismatchException(TOO_MUCH_DATA);
    }

    public static LocalStoreFileSizeMismatchException sizeMismatch() {
        return new LocalStoreFileSizeMismatchException(SIZE_MISMATCH);
    }
}
