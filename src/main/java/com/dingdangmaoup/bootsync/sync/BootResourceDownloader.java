package com.dingdangmaoup.bootsync.sync;

import com.dingdangmaoup.bootsync.config.properties.SyncProperties;
import com.dingdangmaoup.bootsync.coordination.DistributedLock;
import com.dingdangmaoup.bootsync.metrics.SyncMetrics;
import com.dingdangmaoup.bootsync.resource.BootResourceFileService;
import com.dingdangmaoup.bootsync.simplestreams.DownloadAuthenticator;
import com.dingdangmaoup.bootsync.storage.ImageStorage;
import com.dingdangmaoup.bootsync.storage.LocalStoreAllocationFailException;
import com.dingdangmaoup.bootsync.storage.LocalStoreFileSizeMismatchException;
import com.dingdangmaoup.bootsync.storage.LocalStoreInvalidHashException;
import com.dingdangmaoup.bootsync.storage.ReactiveLocalBootResourceFile;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRange;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;
import reactor.util.retry.Retry;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetches boot resource files into the local image storage, from an upstream mirror or
 * from another region.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BootResourceDownloader {

    private final WebClient downloadWebClient;
    private final DownloadAuthenticator downloadAuthenticator;
    private final DistributedLock distributedLock;
    private final ImageStorage imageStorage;
    private final BootResourceFileService fileService;
    private final SyncProperties syncProperties;
    private final SyncMetrics syncMetrics;

    private final Map<String, WebClient> proxiedClients = new ConcurrentHashMap<>();

    /**
     * Download a file, retrying with the next source on failure until the download
     * timeout expires.
     *
     * @return Mono emitting true once the file is stored, or false when the disk is full
     */
    public Mono<Boolean> download(ResourceDownloadParam param) {
        if (param.getSourceList().isEmpty()) {
            return Mono.error(new IllegalArgumentException("No source to download " + param.getSha256() + " from"));
        }
        AtomicInteger attempt = new AtomicInteger();
        return Mono.defer(() -> downloadAttempt(param, attempt.getAndIncrement()))
                .doOnError(error -> {
                    syncMetrics.recordDownloadFailure();
                    log.warn("Download of {} failed: {}", param.getFilenameOnDisk(), error.getMessage());
                })
                .retryWhen(Retry.backoff(Long.MAX_VALUE, syncProperties.getRetryBackoff())
                        .maxBackoff(syncProperties.getMaxRetryBackoff())
                        .filter(error -> !(error instanceof IllegalArgumentException)))
                .timeout(syncProperties.getDownloadTimeout());
    }

    /**
     * One attempt of {@link #download(ResourceDownloadParam)}, using source
     * {@code attempt % sources}.
     */
    public Mono<Boolean> downloadAttempt(ResourceDownloadParam param, int attempt) {
        List<String> sources = param.getSourceList();
        String url = sources.get(attempt % sources.size());
        ReactiveLocalBootResourceFile lfile = imageStorage.reactiveFile(
                param.getSha256(), param.getFilenameOnDisk(), param.getTotalSize());
        log.debug("Downloading {} from {}", param.getFilenameOnDisk(), url);

        Mono<Boolean> work = lfile.valid()
                .flatMap(valid -> {
                    if (valid) {
                        log.info("File {} already downloaded, skipping", param.getFilenameOnDisk());
                        syncMetrics.recordSkippedDownload();
                        return finish(param, lfile);
                    }
                    Timer.Sample sample = syncMetrics.startDownloadTimer();
                    return fetch(url, param, lfile)
                            .doOnSuccess(size -> {
                                syncMetrics.recordDownload(param.getTotalSize());
                                syncMetrics.recordDownloadLatency(sample);
                            })
                            .then(finish(param, lfile));
                })
                .onErrorResume(LocalStoreAllocationFailException.class, e -> lfile.unlink()
                        .then(report(param, 0))
                        .then(Mono.fromRunnable(() -> log.error("Download of {} stopped: {}",
                                param.getFilenameOnDisk(), e.getMessage())))
                        .thenReturn(false))
                .onErrorResume(e -> e instanceof LocalStoreInvalidHashException
                                || e instanceof LocalStoreFileSizeMismatchException,
                        e -> report(param, 0).then(Mono.error(e)));

        return distributedLock.withLock(DistributedLock.fileLockKey(param.getFilenameOnDisk()), work);
    }

    private Mono<Boolean> finish(ResourceDownloadParam param, ReactiveLocalBootResourceFile lfile) {
        return Flux.fromIterable(param.getExtractPaths())
                .concatMap(lfile::extractFile)
                .then(report(param, param.getTotalSize()))
                .thenReturn(true);
    }

    /**
     * Stream the source into the file, resuming after the bytes already on disk when the
     * source honours range requests.
     */
    private Mono<Long> fetch(String url, ResourceDownloadParam param, ReactiveLocalBootResourceFile lfile) {
        URI uri = URI.create(url);
        return lfile.size()
                .flatMap(size -> size >= param.getTotalSize()
                        ? lfile.unlink().thenReturn(0L)
                        : Mono.just(size))
                .flatMap(offset -> downloadAuthenticator.authorization(uri)
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .flatMap(authorization -> clientFor(param.getHttpProxy()).get()
                                .uri(uri)
                                .headers(headers -> {
                                    authorization.ifPresent(value -> headers.set(HttpHeaders.AUTHORIZATION, value));
                                    if (offset > 0) {
                                        headers.setRange(List.of(HttpRange.createByteRange(offset)));
                                    }
                                })
                                .exchangeToMono(response -> {
                                    if (response.statusCode().isError()) {
                                        return response.createError();
                                    }
                                    Flux<DataBuffer> body = response.bodyToFlux(DataBuffer.class);
                                    if (offset > 0 && response.statusCode().value() != HttpStatus.PARTIAL_CONTENT.value()) {
                                        log.debug("{} ignored the range request, restarting {}", url, param.getFilenameOnDisk());
                                        return lfile.unlink()
                                                .then(lfile.store(withProgressReports(param, 0, body)));
                                    }
                                    if (offset > 0) {
                                        log.debug("Resuming {} at {} bytes", param.getFilenameOnDisk(), offset);
                                    }
                                    return lfile.store(withProgressReports(param, offset, body));
                                })));
    }

    private Flux<DataBuffer> withProgressReports(ResourceDownloadParam param, long offset, Flux<DataBuffer> body) {
        AtomicLong received = new AtomicLong(offset);
        AtomicLong lastReport = new AtomicLong(System.nanoTime());
        long interval = syncProperties.getReportInterval().toNanos();
        return body
                .concatMap(buffer -> {
                    long stored = received.getAndAdd(buffer.readableByteCount());
                    long now = System.nanoTime();
                    long last = lastReport.get();
                    if (now - last >= interval && lastReport.compareAndSet(last, now)) {
                        return report(param, stored).thenReturn(buffer);
                    }
                    return Mono.just(buffer);
                })
                .doOnDiscard(DataBuffer.class, DataBufferUtils::release);
    }

    private Mono<Void> report(ResourceDownloadParam param, long size) {
        return fileService.recordProgress(param.getFileIds(), size);
    }

    private WebClient clientFor(String httpProxy) {
        if (httpProxy == null || httpProxy.isBlank()) {
            return downloadWebClient;
        }
        return proxiedClients.computeIfAbsent(httpProxy, proxy -> {
            URI proxyUri = URI.create(proxy);
            int port = proxyUri.getPort() == -1 ? 80 : proxyUri.getPort();
            HttpClient httpClient = HttpClient.create()
                    .proxy(spec -> spec.type(ProxyProvider.Proxy.HTTP)
                            .host(proxyUri.getHost())
                            .port(port));
            log.info("Using proxy {}:{} for boot resource downloads", proxyUri.getHost(), port);
            return downloadWebClient.mutate()
                    .clientConnector(new ReactorClientHttpConnector(httpClient))
                    .build();
        });
    }
}
