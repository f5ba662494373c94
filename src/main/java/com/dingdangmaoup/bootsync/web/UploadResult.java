package com.dingdangmaoup.bootsync.web;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UploadResult {
    long fileId;
    String sha256;
    String filenameOnDisk;
    long size;
}
