package com.dingdangmaoup.bootsync.layout;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum PartitionTableType {

    GPT("gpt"),
    MBR("mbr");

    @JsonValue
    private final String value;

    public static PartitionTableType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown partition table type: " + value));
    }
}
