package com.dingdangmaoup.bootsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Connection settings of the Redis instance shared by all region controllers
 */
@Data
@Component
@ConfigurationProperties(prefix = "bootsync.redis")
public class RedisProperties {

    private Mode mode = Mode.STANDALONE;
    private String host = "localhost";
    private int port = 6379;
    private String password;
    private int database = 0;
    private Duration timeout = Duration.ofSeconds(5);

    private SentinelConfig sentinel = new SentinelConfig();

    public enum Mode {
        STANDALONE,
        SENTINEL
    }

    @Data
    public static class SentinelConfig {
        private String master = "mymaster";

        /**
         * Comma-separated host:port list
         */
        private String nodes;

        public List<String> getNodesList() {
            if (nodes == null || nodes.isBlank()) {
                return List.of();
            }
            return Arrays.stream(nodes.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
    }

    public boolean hasPassword() {
        return password != null && !password.isBlank();
    }
}
