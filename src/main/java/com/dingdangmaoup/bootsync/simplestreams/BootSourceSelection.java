package com.dingdangmaoup.bootsync.simplestreams;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Images an operator selected from a boot source; also the filter applied when merging
 * that source's descriptions. {@code "*"} matches any value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BootSourceSelection {

    private String os;
    private String release;

    @Builder.Default
    private List<String> arches = new ArrayList<>();

    @Builder.Default
    private List<String> subarches = new ArrayList<>();

    @Builder.Default
    private List<String> labels = new ArrayList<>();
}
