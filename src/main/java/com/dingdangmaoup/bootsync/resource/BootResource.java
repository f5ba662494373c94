package com.dingdangmaoup.bootsync.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named OS image, e.g. {@code ubuntu/jammy} for {@code amd64/generic}
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BootResource {

    private Long id;
    private BootResourceType rtype;
    private String name;
    private String architecture;

    /**
     * Set for bootloader resources, e.g. {@code uefi} or {@code pxe}
     */
    private String bootloaderType;

    public enum BootResourceType {
        SYNCED,
        UPLOADED
    }
}
