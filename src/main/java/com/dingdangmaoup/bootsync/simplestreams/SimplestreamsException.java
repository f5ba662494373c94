package com.dingdangmaoup.bootsync.simplestreams;

import lombok.Getter;

/**
 * Transport failure while talking to a simplestreams mirror
 */
@Getter
public class SimplestreamsException extends RuntimeException {

    private final int statusCode;

    public SimplestreamsException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public SimplestreamsException(String message, Throwable cause) {
        this(message, 0, cause);
    }
}
