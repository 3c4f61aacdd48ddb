package com.narraflow.narraflow_backend.service;

import com.narraflow.narraflow_backend.config.TrashProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Permanently deletes flows that have stayed in the trash longer than the retention window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrashPurgeJob {

    private final FlowGraphService flowGraphService;
    private final TrashProperties properties;

    @Scheduled(fixedDelayString = "${narraflow.trash.purge-interval-ms:3600000}",
            initialDelayString = "${narraflow.trash.purge-interval-ms:3600000}")
    public void purgeExpired() {
        if (properties.getRetentionDays() <= 0) {
            return;
        }
        Instant cutoff = Instant.now().minus(Duration.ofDays(properties.getRetentionDays()));
        try {
            int purged = flowGraphService.purgeTrash(cutoff);
            if (purged > 0) {
                log.info("Purged {} flow(s) trashed before {}", purged, cutoff);
            }
        } catch (RuntimeException e) {
            log.error("Trash purge failed, will retry on the next run", e);
        }
    }
}
