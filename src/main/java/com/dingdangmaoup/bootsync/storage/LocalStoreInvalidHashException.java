package com.dingdangmaoup.bootsync.storage;

public class LocalStoreInvalidHashException extends LocalStoreException {

    public static final String MESSAGE = "Saved content does not match given SHA256 value";

    public LocalStoreInvalidHashException() {
        super(MESSAGE);
    }
}
