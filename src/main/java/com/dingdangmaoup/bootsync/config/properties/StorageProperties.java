package com.dingdangmaoup.bootsync.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Image storage configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "bootsync.storage")
public class StorageProperties {

    /**
     * Directory holding one file per distinct filename-on-disk
     */
    private String basePath = "/var/lib/maas/image-storage";

    /**
     * Uploads are buffered up to this size before each disk write
     */
    private DataSize chunkSize = DataSize.ofMegabytes(4);

    /**
     * Free space below which the readiness probe reports DOWN
     */
    private DataSize minFreeSpace = DataSize.ofGigabytes(1);

    /**
     * Number of leading sha256 hex characters used as the on-disk filename
     */
    private int filenameLength = 7;
}
