package com.dingdangmaoup.bootsync.config;

import com.dingdangmaoup.bootsync.config.properties.StorageProperties;
import com.dingdangmaoup.bootsync.config.properties.SyncProperties;
import com.dingdangmaoup.bootsync.storage.FileSystemImageStoreIo;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class StorageConfig {

    private final StorageProperties storageProperties;
    private final SyncProperties syncProperties;

    @PostConstruct
    public void initializeStorage() {
        try {
            Path base = Paths.get(storageProperties.getBasePath());
            Path bootloaders = base.resolve(syncProperties.getBootloadersDir());

            Files.createDirectories(base);
            Files.createDirectories(bootloaders);

            log.info("Initialized image storage at {}", base.toAbsolutePath());

            if (!Files.isWritable(base)) {
                throw new IllegalStateException("Image storage path is not writable: " + base);
            }
        } catch (IOException e) {
            log.error("Failed to initialize image storage", e);
            throw new RuntimeException("Failed to initialize image storage", e);
        }
    }

    @Bean
    public ImageStorage imageStorage() {
        return new ImageStorage(Paths.get(storageProperties.getBasePath()), new FileSystemImageStoreIo());
    }
}
