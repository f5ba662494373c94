package com.dingdangmaoup.bootsync.simplestreams;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Downloads image descriptions from boot sources and merges them into one mapping
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageDescriptionService {

    private final SimplestreamsClient simplestreamsClient;
    private final Cache<String, BootImageMapping> imageDescriptionsCache;

    /**
     * Sources are merged in order: an image offered by an earlier source is never replaced
     * by a later one. Each source contributes only what its selections let through.
     */
    public Mono<BootImageMapping> downloadAllImageDescriptions(List<BootSource> sources) {
        BootImageMapping total = new BootImageMapping();
        return Flux.fromIterable(sources)
                .concatMap(source -> downloadImageDescriptions(source)
                        .doOnNext(repo -> BootImageMerger.bootMerge(total, repo, source.getSelections())))
                .then(Mono.fromSupplier(() -> {
                    log.info("Merged image descriptions from {} source(s): {} images", sources.size(), total.size());
                    return total;
                }));
    }

    /**
     * Unfiltered descriptions of a single source
     */
    public Mono<BootImageMapping> downloadImageDescriptions(BootSource source) {
        BootImageMapping cached = imageDescriptionsCache.getIfPresent(source.getUrl());
        if (cached != null) {
            log.debug("Image descriptions cache HIT: {}", source.getUrl());
            return Mono.just(cached);
        }
        RepoDumper dumper = new RepoDumper(new BootImageMapping());
        return dumper.sync(simplestreamsClient.readerFor(source.getUrl()), SimplestreamsClient.INDEX_PATH)
                .doOnNext(mapping -> {
                    imageDescriptionsCache.put(source.getUrl(), mapping);
                    log.info("Downloaded {} image descriptions from {}", mapping.size(), source.getUrl());
                });
    }

    public void invalidate() {
        imageDescriptionsCache.invalidateAll();
    }
}
