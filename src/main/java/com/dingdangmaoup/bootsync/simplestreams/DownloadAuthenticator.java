package com.dingdangmaoup.bootsync.simplestreams;

import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Supplies the Authorization header value for downloads that need credentials.
 * Completes empty when the request goes out unauthenticated.
 */
@FunctionalInterface
public interface DownloadAuthenticator {

    DownloadAuthenticator NONE = uri -> Mono.empty();

    Mono<String> authorization(URI uri);
}
