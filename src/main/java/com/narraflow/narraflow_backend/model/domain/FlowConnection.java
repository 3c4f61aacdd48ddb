package com.narraflow.narraflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "flow_connections", indexes = {
        @Index(name = "idx_flow_connections_flow", columnList = "flow_id")
})
@Data
public class FlowConnection {

    public static final String DEFAULT_SOURCE_PIN = "output";
    public static final String DEFAULT_TARGET_PIN = "input";

    @Id
    private UUID id;

    @Column(name = "flow_id", nullable = false)
    private UUID flowId;

    @Column(name = "source_node_id", nullable = false)
    private UUID sourceNodeId;

    // Output pin on the source, e.g. "output", "true", "false" or a dialogue response id
    @Column(name = "source_pin", nullable = false)
    private String sourcePin = DEFAULT_SOURCE_PIN;

    @Column(name = "target_node_id", nullable = false)
    private UUID targetNodeId;

    @Column(name = "target_pin", nullable = false)
    private String targetPin = DEFAULT_TARGET_PIN;

    private String label;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();
}
