package com.dingdangmaoup.bootsync.simplestreams;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Reads simplestreams documents relative to a mirror root
 */
@FunctionalInterface
public interface SimplestreamsReader {

    Mono<JsonNode> read(String path);
}
