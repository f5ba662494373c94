package com.dingdangmaoup.bootsync.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "bootsync.simplestreams")
public class SimplestreamsProperties {

    private String userAgent = "bootsync";
    private Duration timeout = Duration.ofSeconds(60);
    private DataSize maxInMemorySize = DataSize.ofMegabytes(64);
    private RetryConfig retry = new RetryConfig();
    private DescriptionsCacheConfig descriptionsCache = new DescriptionsCacheConfig();

    @Data
    public static class RetryConfig {
        private long maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class DescriptionsCacheConfig {
        /**
         * How long a downloaded image description stays valid
         */
        private Duration ttl = Duration.ofMinutes(10);

        /**
         * Maximum number of cached source descriptions
         */
        private long maxEntries = 32;
    }
}
