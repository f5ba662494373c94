package com.dingdangmaoup.bootsync.resource;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncStatus {
    long setId;
    double progress;
    boolean complete;
    boolean usable;
    boolean xinstallable;
}
