package com.dingdangmaoup.bootsync.simplestreams;

import com.dingdangmaoup.bootsync.config.properties.SimplestreamsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SimplestreamsClientTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private static SimplestreamsProperties properties() {
        SimplestreamsProperties properties = new SimplestreamsProperties();
        properties.getRetry().setMaxAttempts(2);
        properties.getRetry().setInitialBackoff(Duration.ofMillis(1));
        properties.getRetry().setMaxBackoff(Duration.ofMillis(5));
        return properties;
    }

    private SimplestreamsClient client(DownloadAuthenticator authenticator, HttpStatus... statuses) {
        AtomicInteger calls = new AtomicInteger();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    HttpStatus status = statuses[Math.min(calls.getAndIncrement(), statuses.length - 1)];
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body(status.is2xxSuccessful() ? "{\"index\": {}}" : "{}")
                            .build());
                })
                .build();
        return new SimplestreamsClient(webClient, properties(), authenticator, new ObjectMapper());
    }

    @Test
    void testReaderFor_resolvesPathAgainstMirror() {
        SimplestreamsClient client = client(DownloadAuthenticator.NONE, HttpStatus.OK);

        StepVerifier.create(client.readerFor("http://images.example.com/ephemeral-v3/stable").read("streams/v1/index.json"))
                .assertNext(document -> assertTrue(document.has("index")))
                .verifyComplete();

        assertEquals("http://images.example.com/ephemeral-v3/stable/streams/v1/index.json",
                requests.get(0).url().toString());
        assertNull(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testFetch_authenticatorSuppliesHeader() {
        SimplestreamsClient client = client(uri -> Mono.just("Macaroon root=abc"), HttpStatus.OK);

        StepVerifier.create(client.readerFor("http://images.example.com/").read("streams/v1/index.json"))
                .expectNextCount(1)
                .verifyComplete();

        assertEquals("Macaroon root=abc", requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testFetch_serverError_retried() {
        SimplestreamsClient client = client(DownloadAuthenticator.NONE,
                HttpStatus.SERVICE_UNAVAILABLE, HttpStatus.OK);

        StepVerifier.create(client.readerFor("http://images.example.com/").read("streams/v1/index.json"))
                .expectNextCount(1)
                .verifyComplete();

        assertEquals(2, requests.size());
    }

    @Test
    void testFetch_notFound_notRetriedAndMapped() {
        SimplestreamsClient client = client(DownloadAuthenticator.NONE, HttpStatus.NOT_FOUND);

        StepVerifier.create(client.readerFor("http://images.example.com/").read("streams/v1/index.json"))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(SimplestreamsException.class, e);
                    assertEquals(404, ((SimplestreamsException) e).getStatusCode());
                })
                .verify();

        assertEquals(1, requests.size());
    }
}
