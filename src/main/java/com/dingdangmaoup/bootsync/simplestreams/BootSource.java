package com.dingdangmaoup.bootsync.simplestreams;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A simplestreams mirror images are imported from
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BootSource {

    private String url;

    @Builder.Default
    private List<BootSourceSelection> selections = new ArrayList<>();
}
