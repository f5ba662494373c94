package com.dingdangmaoup.bootsync.simplestreams;

import com.dingdangmaoup.bootsync.config.properties.SimplestreamsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SimplestreamsClient {

    public static final String INDEX_PATH = "streams/v1/index.json";

    private final WebClient simplestreamsWebClient;
    private final SimplestreamsProperties simplestreamsProperties;
    private final DownloadAuthenticator downloadAuthenticator;
    private final ObjectMapper objectMapper;

    /**
     * Reader resolving document paths against {@code mirrorUrl}
     */
    public SimplestreamsReader readerFor(String mirrorUrl) {
        URI base = URI.create(mirrorUrl.endsWith("/") ? mirrorUrl : mirrorUrl + "/");
        return path -> fetch(base.resolve(path));
    }

    /**
     * Fetch one JSON document; 5xx responses and connection errors are retried with backoff.
     */
    public Mono<JsonNode> fetch(URI uri) {
        SimplestreamsProperties.RetryConfig retry = simplestreamsProperties.getRetry();
        return downloadAuthenticator.authorization(uri)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(authorization -> simplestreamsWebClient.get()
                        .uri(uri)
                        .headers(headers -> authorization.ifPresent(
                                value -> headers.set(HttpHeaders.AUTHORIZATION, value)))
                        .retrieve()
                        .bodyToMono(String.class))
                .map(body -> parse(uri, body))
                .doOnNext(document -> log.debug("Fetched simplestreams document {}", uri))
                .retryWhen(Retry.backoff(retry.getMaxAttempts(), retry.getInitialBackoff())
                        .maxBackoff(retry.getMaxBackoff())
                        .filter(SimplestreamsClient::isTransient)
                        .doBeforeRetry(signal -> log.warn("Retrying {} after failure (attempt {}): {}",
                                uri, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(WebClientResponseException.class, ex ->
                        new SimplestreamsException("Failed to fetch " + uri + ": " + ex.getMessage(),
                                ex.getStatusCode().value(), ex))
                .onErrorMap(WebClientRequestException.class, ex ->
                        new SimplestreamsException("Failed to connect to " + uri + ": " + ex.getMessage(), ex));
    }

    private JsonNode parse(URI uri, String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SimplestreamsException("Malformed simplestreams document " + uri, e);
        }
    }

    private static boolean isTransient(Throwable throwable) {
        if (throwable instanceof WebClientResponseException ex) {
            return ex.getStatusCode().is5xxServerError();
        }
        return throwable instanceof WebClientRequestException;
    }
}
