package com.dingdangmaoup.bootsync.web;

import com.dingdangmaoup.bootsync.layout.StorageLayoutParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

class StorageLayoutControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        StorageLayoutParser parser = new StorageLayoutParser(new ObjectMapper(new YAMLFactory()));
        client = WebTestClient.bindToController(new StorageLayoutController(parser))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testParse_validLayout_returnsSortedEntries() {
        String layout = """
                layout:
                  sda:
                    type: disk
                    ptable: gpt
                    boot: true
                    partitions:
                      - name: sda1
                        size: 500M
                        fs: vfat
                      - name: sda2
                        size: 20G
                        fs: ext4
                mounts:
                  /:
                    device: sda2
                  /boot/efi:
                    device: sda1
                """;

        client.post().uri("/MAAS/api/storage-layouts/parse")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(layout)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.disks[0]").isEqualTo("sda")
                .jsonPath("$.entries.length()").isEqualTo(5)
                .jsonPath("$.entries[0].kind").isEqualTo("disk")
                .jsonPath("$.entries[0].ptable").isEqualTo("gpt")
                .jsonPath("$.entries[1].kind").isEqualTo("partition")
                .jsonPath("$.entries[1].name").isEqualTo("sda1")
                .jsonPath("$.entries[1].size").isEqualTo(500_000_000)
                .jsonPath("$.entries[2].kind").isEqualTo("filesystem")
                .jsonPath("$.entries[2].mount").isEqualTo("/boot/efi")
                .jsonPath("$.entries[4].mount").isEqualTo("/");
    }

    @Test
    void testParse_invalidLayout_returnsBadRequestWithMessage() {
        String layout = """
                layout:
                  sda:
                    type: disk
                    partitions:
                      - name: sda1
                        size: 5G
                mounts: {}
                """;

        client.post().uri("/MAAS/api/storage-layouts/parse")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(layout)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_storage_layout")
                .jsonPath("$.message").isEqualTo("Partition table not specified for 'sda'");
    }
}
