package com.dingdangmaoup.bootsync.sync;

import com.dingdangmaoup.bootsync.resource.BootResource;
import com.dingdangmaoup.bootsync.resource.BootResourceFile;
import com.dingdangmaoup.bootsync.resource.BootResourceSet;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Latest version of a simplestreams product that passed the selections, with the
 * records it maps to. File records may not be saved yet.
 */
@Value
@Builder
public class DownloadableProduct {

    BootResource resource;
    BootResourceSet resourceSet;

    @Singular
    List<ProductFile> files;

    @Value(staticConstructor = "of")
    public static class ProductFile {
        BootResourceFile file;

        /**
         * Path of the file relative to the mirror URL
         */
        String path;
    }
}
