package com.dingdangmaoup.bootsync.storage;

/**
 * Base class of the errors raised while storing the content of a boot resource file.
 * The message is the human-readable reason returned to uploading clients.
 */
public abstract class LocalStoreException extends StorageException {

    protected LocalStoreException(String message) {
        super(message);
    }

    protected LocalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
