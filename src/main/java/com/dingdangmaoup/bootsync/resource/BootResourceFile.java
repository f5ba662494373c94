package com.dingdangmaoup.bootsync.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BootResourceFile {

    private Long id;
    private Long resourceSetId;
    private String filename;
    private BootResourceFileType filetype;
    private String sha256;
    private String filenameOnDisk;
    private long size;

    /**
     * Free-form attributes from the source, e.g. {@code bootloader-type}
     */
    @Builder.Default
    private Map<String, String> extra = new HashMap<>();
}
