package com.dingdangmaoup.bootsync.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One version of a boot resource. Higher ids are newer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BootResourceSet {

    private Long id;
    private Long resourceId;
    private String version;
    private String label;
}
