package com.dingdangmaoup.bootsync.sync;

/**
 * A sync run was aborted
 */
public class SyncException extends RuntimeException {

    public SyncException(String message) {
        super(message);
    }
}
