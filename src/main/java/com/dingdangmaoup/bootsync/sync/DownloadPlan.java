package com.dingdangmaoup.bootsync.sync;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Downloads needed by a set of products, one per distinct sha256
 */
public class DownloadPlan {

    private final Map<String, ResourceDownloadParam> downloads = new LinkedHashMap<>();

    /**
     * Boot resources the products map to; the others are candidates for removal
     */
    @Getter
    private final Set<Long> resourceIds = new LinkedHashSet<>();

    void add(ResourceDownloadParam download) {
        ResourceDownloadParam existing = downloads.get(download.getSha256());
        if (existing != null) {
            existing.merge(download);
        } else {
            downloads.put(download.getSha256(), download);
        }
    }

    void addResourceId(long resourceId) {
        resourceIds.add(resourceId);
    }

    public List<ResourceDownloadParam> getDownloads() {
        return new ArrayList<>(downloads.values());
    }

    public ResourceDownloadParam get(String sha256) {
        return downloads.get(sha256);
    }

    public long getTotalSize() {
        return downloads.values().stream().mapToLong(ResourceDownloadParam::getTotalSize).sum();
    }

    public boolean isEmpty() {
        return downloads.isEmpty();
    }
}
