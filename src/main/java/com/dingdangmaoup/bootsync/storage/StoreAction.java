package com.dingdangmaoup.bootsync.storage;

import java.io.IOException;

/**
 * Body of a {@link LocalBootResourceFile#store(StoreAction)} scope.
 */
@FunctionalInterface
public interface StoreAction {

    void write(StoreWriter writer) throws IOException;
}
