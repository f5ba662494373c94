package com.dingdangmaoup.bootsync.web;

import com.dingdangmaoup.bootsync.layout.StorageEntry;
import com.dingdangmaoup.bootsync.layout.StorageLayout;
import com.dingdangmaoup.bootsync.layout.StorageLayoutParser;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Set;

/**
 * Validates custom storage layouts before they are attached to machines
 */
@Slf4j
@RestController
@RequestMapping("/MAAS/api/storage-layouts")
@RequiredArgsConstructor
public class StorageLayoutController {

    private final StorageLayoutParser parser;

    /**
     * Compile a YAML or JSON layout document into its dependency ordered entries
     */
    @PostMapping(value = "/parse", consumes = {
            MediaType.TEXT_PLAIN_VALUE, "application/yaml", "application/x-yaml", MediaType.APPLICATION_JSON_VALUE})
    public Mono<CompiledLayout> parse(@RequestBody String document) {
        return Mono.fromCallable(() -> parser.parseYaml(document))
                .subscribeOn(Schedulers.parallel())
                .map(layout -> CompiledLayout.builder()
                        .disks(layout.diskNames())
                        .entries(layout.getSortedEntries())
                        .build())
                .doOnNext(compiled -> log.debug("Compiled storage layout with {} entries",
                        compiled.getEntries().size()));
    }

    @Value
    @Builder
    public static class CompiledLayout {
        Set<String> disks;
        List<StorageEntry> entries;
    }
}
