package com.dingdangmaoup.bootsync.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One file to fetch into the image storage, possibly shared by several boot resource
 * file records with the same sha256.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResourceDownloadParam {

    @Builder.Default
    private List<Long> fileIds = new ArrayList<>();

    /**
     * Candidate URLs; attempt {@code n} uses {@code sourceList[n % size]}.
     * Empty when the file can only come from another region.
     */
    @Builder.Default
    private List<String> sourceList = new ArrayList<>();

    private String sha256;
    private String filenameOnDisk;
    private long totalSize;
    private long size;
    private boolean force;

    /**
     * Directories, relative to the image storage, the file is extracted into once stored
     */
    @Builder.Default
    private List<String> extractPaths = new ArrayList<>();

    private String httpProxy;

    /**
     * Fold another request for the same content into this one.
     */
    public void merge(ResourceDownloadParam other) {
        if (!sha256.equals(other.getSha256())) {
            throw new IllegalArgumentException("Cannot merge downloads of " + sha256 + " and " + other.getSha256());
        }
        fileIds.addAll(other.getFileIds());
        sourceList.addAll(other.getSourceList());
        extractPaths.addAll(other.getExtractPaths());
    }
}
