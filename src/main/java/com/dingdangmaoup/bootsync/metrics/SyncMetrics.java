package com.dingdangmaoup.bootsync.metrics;

import com.dingdangmaoup.bootsync.storage.ImageStorage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Boot resource sync metrics collection
 */
@Slf4j
@Component
public class SyncMetrics {

    private final MeterRegistry meterRegistry;
    private final ImageStorage imageStorage;

    private final Counter downloadedFiles;
    private final Counter downloadedBytes;
    private final Counter skippedDownloads;
    private final Counter failedDownloads;
    private final Counter failedSyncs;
    private final Counter uploadedBytes;
    private final Timer downloadLatency;

    private final AtomicLong storedBytes = new AtomicLong();

    public SyncMetrics(MeterRegistry meterRegistry, ImageStorage imageStorage) {
        this.meterRegistry = meterRegistry;
        this.imageStorage = imageStorage;

        this.downloadedFiles = Counter.builder("bootsync.download.files")
                .description("Number of boot resource files downloaded and verified")
                .register(meterRegistry);

        this.downloadedBytes = Counter.builder("bootsync.download.bytes")
                .baseUnit("bytes")
                .description("Bytes of boot resource files downloaded and verified")
                .register(meterRegistry);

        this.skippedDownloads = Counter.builder("bootsync.download.skipped")
                .description("Number of downloads skipped because the file was already stored")
                .register(meterRegistry);

        this.failedDownloads = Counter.builder("bootsync.download.failures")
                .description("Number of failed download attempts")
                .register(meterRegistry);

        this.failedSyncs = Counter.builder("bootsync.sync.failures")
                .description("Number of aborted sync runs")
                .register(meterRegistry);

        this.uploadedBytes = Counter.builder("bootsync.upload.bytes")
                .baseUnit("bytes")
                .description("Bytes of boot resource files received through uploads")
                .register(meterRegistry);

        this.downloadLatency = Timer.builder("bootsync.download.latency")
                .description("Time to download and verify one boot resource file")
                .register(meterRegistry);

        Gauge.builder("bootsync.storage.bytes", storedBytes, AtomicLong::get)
                .baseUnit("bytes")
                .description("Bytes held in the image storage")
                .register(meterRegistry);
    }

    public void recordDownload(long bytes) {
        downloadedFiles.increment();
        downloadedBytes.increment(bytes);
    }

    public void recordSkippedDownload() {
        skippedDownloads.increment();
    }

    public void recordDownloadFailure() {
        failedDownloads.increment();
    }

    public void recordUploadFailure(String kind) {
        Counter.builder("bootsync.upload.failures")
                .tag("kind", kind)
                .description("Number of rejected uploads")
                .register(meterRegistry)
                .increment();
    }

    public void recordUpload(long bytes) {
        uploadedBytes.increment(bytes);
    }

    public void recordSyncFailure() {
        failedSyncs.increment();
    }

    public Timer.Sample startDownloadTimer() {
        return Timer.start();
    }

    public void recordDownloadLatency(Timer.Sample sample) {
        sample.stop(downloadLatency);
    }

    @Scheduled(fixedDelayString = "${bootsync.metrics.storage-refresh-interval:60s}")
    public void refreshStoredBytes() {
        imageStorage.getStoredBytes()
                .subscribe(storedBytes::set,
                        error -> log.warn("Failed to measure image storage: {}", error.getMessage()));
    }

    public long getStoredBytes() {
        return storedBytes.get();
    }
}
