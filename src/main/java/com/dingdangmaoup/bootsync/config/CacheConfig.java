package com.dingdangmaoup.bootsync.config;

import com.dingdangmaoup.bootsync.config.properties.SimplestreamsProperties;
import com.dingdangmaoup.bootsync.simplestreams.BootImageMapping;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

    private final SimplestreamsProperties simplestreamsProperties;

    /**
     * Image descriptions keyed by source mirror URL
     */
    @Bean
    public Cache<String, BootImageMapping> imageDescriptionsCache() {
        SimplestreamsProperties.DescriptionsCacheConfig config = simplestreamsProperties.getDescriptionsCache();
        log.info("Initialized image descriptions cache with maxEntries={}, ttl={}",
                config.getMaxEntries(), config.getTtl());

        return Caffeine.newBuilder()
                .maximumSize(config.getMaxEntries())
                .expireAfterWrite(config.getTtl())
                .recordStats()
                .build();
    }
}
