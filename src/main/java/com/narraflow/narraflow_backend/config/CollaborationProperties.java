package com.narraflow.narraflow_backend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Timing of edit leases, presence and cursor broadcasts.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "narraflow.collaboration")
public class CollaborationProperties {

    /**
     * How long a lease lives without a heartbeat.
     */
    private long leaseTtlMs = 30_000;

    /**
     * A session with no activity for this long is treated as disconnected.
     */
    private long sessionTimeoutMs = 120_000;

    /**
     * Minimum spacing between two cursor broadcasts of the same session.
     */
    private long cursorBroadcastIntervalMs = 50;
}
