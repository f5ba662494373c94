package com.dingdangmaoup.bootsync.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Boot resource download and fan-out properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "bootsync.sync")
public class SyncProperties {

    /**
     * Minimum interval between two progress reports of a running download
     */
    private Duration reportInterval = Duration.ofSeconds(10);

    private Duration downloadTimeout = Duration.ofHours(2);

    /**
     * Delay before the first retry of a failed download, doubled on each attempt
     */
    private Duration retryBackoff = Duration.ofSeconds(1);

    private Duration maxRetryBackoff = Duration.ofSeconds(60);

    /**
     * Maximum number of peer URLs handed to a single download
     */
    private int maxSources = 5;

    /**
     * Downloads running at the same time during one sync
     */
    private int concurrentDownloads = 8;

    private Duration peerSyncInterval = Duration.ofSeconds(60);

    /**
     * Sub-directory of the image storage where bootloader archives are extracted
     */
    private String bootloadersDir = "bootloaders";

    /**
     * Path under which every region serves its stored files
     */
    private String fileEndpointPath = "/MAAS/boot-resources/";
}
