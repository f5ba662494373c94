package com.dingdangmaoup.bootsync.region;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RegionInfo {
    @EqualsAndHashCode.Include
    private String regionId;
    private String host;
    private int httpPort;
    private RegionStatus status;
    private Instant lastHeartbeat;
    private long uptimeSeconds;

    public enum RegionStatus {
        HEALTHY,
        UNHEALTHY,
        DRAINING
    }

    /**
     * Base URL peers download this region's stored files from
     */
    @JsonIgnore
    public String getHttpUrl() {
        return "http://" + host + ":" + httpPort;
    }

    @Override
    public String toString() {
        return String.format("Region[id=%s, http=%s:%d, status=%s]",
                regionId, host, httpPort, status);
    }
}
