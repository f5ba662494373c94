package com.dingdangmaoup.bootsync.layout;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * bcache write policy
 */
@Getter
@RequiredArgsConstructor
public enum CacheMode {

    WRITEBACK("writeback"),
    WRITETHROUGH("writethrough"),
    WRITEAROUND("writearound");

    @JsonValue
    private final String value;

    public static CacheMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(m -> m.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cache mode: " + value));
    }
}
