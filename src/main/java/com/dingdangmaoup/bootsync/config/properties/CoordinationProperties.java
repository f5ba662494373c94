package com.dingdangmaoup.bootsync.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "bootsync.coordination")
public class CoordinationProperties {

    private LockConfig lock = new LockConfig();

    @Data
    public static class LockConfig {
        private Duration ttl = Duration.ofHours(2);
        private Duration waitTimeout = Duration.ofMinutes(5);
        private Duration retryInterval = Duration.ofSeconds(5);
    }
}
