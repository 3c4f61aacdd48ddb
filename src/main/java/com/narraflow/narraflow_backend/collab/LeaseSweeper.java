package com.narraflow.narraflow_backend.collab;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LeaseSweeper {

    private final FlowSessionRegistry registry;

    @Scheduled(fixedDelayString = "${narraflow.collaboration.sweep-interval-ms:10000}")
    public void sweepExpiredLeases() {
        registry.sweep();
    }

    // Sends cursor positions held back by the per-session rate limit
    @Scheduled(fixedDelayString = "${narraflow.collaboration.cursor-broadcast-interval-ms:50}")
    public void flushCursors() {
        registry.flushCursors();
    }
}
