package com.dingdangmaoup.bootsync.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    @Builder.Default
    private List<ResourceDownloadParam> resources = new ArrayList<>();

    private SpaceRequirement requirement;

    /**
     * Proxy for upstream downloads; region to region transfers never use it
     */
    private String httpProxy;
}
