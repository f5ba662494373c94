package com.dingdangmaoup.bootsync.resource;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException resourceSet(long id) {
        return new NotFoundException("Boot resource set " + id + " does not exist");
    }

    public static NotFoundException resource(long id) {
        return new NotFoundException("Boot resource " + id + " does not exist");
    }

    public static NotFoundException file(long id) {
        return new NotFoundException("Boot resource file " + id + " does not exist");
    }
}
