package com.dingdangmaoup.bootsync.layout;

/**
 * A valid layout that does not match the hardware of the target machine
 */
public class UnappliableLayoutException extends RuntimeException {

    public UnappliableLayoutException(String message) {
        super(message);
    }
}
