package com.dingdangmaoup.bootsync.layout;

/**
 * The storage layout document itself is invalid and has to be edited
 */
public class StorageConfigException extends RuntimeException {

    public StorageConfigException(String message) {
        super(message);
    }

    public static StorageConfigException invalidAt(String path, String reason) {
        String where = path.isEmpty() ? "top level" : path;
        return new StorageConfigException("Invalid config at " + where + ": " + reason);
    }
}
