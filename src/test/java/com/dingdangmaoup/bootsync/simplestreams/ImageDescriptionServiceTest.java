package com.dingdangmaoup.bootsync.simplestreams;

import com.dingdangmaoup.bootsync.config.properties.SimplestreamsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ImageDescriptionServiceTest {

    private static final String INDEX = """
            {"index": {"products": {"format": "products:1.0", "path": "streams/v1/products.json"}}}
            """;

    private static String products(String arch, String path) {
        return """
                {"content_id": "com.ubuntu.maas:stable:v3:download",
                 "products": {
                   "com.ubuntu.maas.stable:v3:boot:22.04:%1$s:ga-22.04": {
                     "os": "ubuntu", "arch": "%1$s", "release": "jammy", "version": "22.04",
                     "subarch": "ga-22.04", "subarches": "generic,ga-22.04", "label": "stable",
                     "versions": {"20240101": {"items": {"squashfs": {"ftype": "squashfs", "path": "%2$s"}}}}
                   }
                 }}
                """.formatted(arch, path);
    }

    private final AtomicInteger requests = new AtomicInteger();

    private ImageDescriptionService service() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.incrementAndGet();
                    String url = request.url().toString();
                    String body;
                    if (url.endsWith("index.json")) {
                        body = INDEX;
                    } else if (url.startsWith("http://first")) {
                        body = products("amd64", "first/squashfs");
                    } else {
                        body = products("arm64", "second/arm64/squashfs");
                    }
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body(body)
                            .build());
                })
                .build();
        SimplestreamsClient client = new SimplestreamsClient(webClient, new SimplestreamsProperties(),
                DownloadAuthenticator.NONE, new ObjectMapper());
        return new ImageDescriptionService(client, Caffeine.newBuilder().build());
    }

    @Test
    void testDownloadAllImageDescriptions_mergesSourcesInOrder() {
        ImageDescriptionService service = service();
        BootSource first = BootSource.builder().url("http://first.example.com/").build();
        BootSource second = BootSource.builder().url("http://second.example.com/").build();

        StepVerifier.create(service.downloadAllImageDescriptions(List.of(first, second)))
                .assertNext(mapping -> {
                    assertEquals(Set.of("amd64", "arm64"), mapping.getImageArches());
                    ImageSpec amd64 = ImageSpec.of("ubuntu", "amd64", "generic", "generic", "jammy", "stable");
                    assertEquals("first/squashfs", mapping.get(amd64).orElseThrow().get("path"));
                })
                .verifyComplete();
    }

    @Test
    void testDownloadAllImageDescriptions_selectionsFilterSource() {
        ImageDescriptionService service = service();
        BootSource source = BootSource.builder()
                .url("http://first.example.com/")
                .selections(List.of(BootSourceSelection.builder()
                        .os("ubuntu")
                        .release("jammy")
                        .arches(List.of("amd64"))
                        .subarches(List.of("generic"))
                        .labels(List.of("*"))
                        .build()))
                .build();

        StepVerifier.create(service.downloadAllImageDescriptions(List.of(source)))
                .assertNext(mapping -> assertEquals(1, mapping.size()))
                .verifyComplete();
    }

    @Test
    void testDownloadImageDescriptions_cachedPerSource() {
        ImageDescriptionService service = service();
        BootSource source = BootSource.builder().url("http://first.example.com/").build();

        StepVerifier.create(service.downloadImageDescriptions(source)).expectNextCount(1).verifyComplete();
        StepVerifier.create(service.downloadImageDescriptions(source)).expectNextCount(1).verifyComplete();

        assertEquals(2, requests.get());
    }
}
