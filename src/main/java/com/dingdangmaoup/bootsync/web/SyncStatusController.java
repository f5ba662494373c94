package com.dingdangmaoup.bootsync.web;

import com.dingdangmaoup.bootsync.resource.BootResourceSetService;
import com.dingdangmaoup.bootsync.resource.SyncStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/MAAS/api/boot-resource-sets")
@RequiredArgsConstructor
public class SyncStatusController {

    private final BootResourceSetService setService;

    /**
     * Sync progress of a resource set across all region controllers
     */
    @GetMapping("/{setId}/sync-status")
    public Mono<SyncStatus> getSyncStatus(@PathVariable long setId) {
        return setService.getSyncStatus(setId);
    }
}
