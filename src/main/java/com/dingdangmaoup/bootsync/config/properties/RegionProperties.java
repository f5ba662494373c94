package com.dingdangmaoup.bootsync.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Identity of this region controller and its registration settings
 */
@Data
@Component
@ConfigurationProperties(prefix = "bootsync.region")
public class RegionProperties {

    private String id = "region-1";
    private String host = "localhost";
    private int httpPort = 5240;
    private Duration heartbeatInterval = Duration.ofSeconds(10);

    /**
     * A region that has not sent a heartbeat for this long is no longer counted
     */
    private Duration timeout = Duration.ofSeconds(30);
}
