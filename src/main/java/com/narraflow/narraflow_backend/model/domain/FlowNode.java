package com.narraflow.narraflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "flow_nodes", indexes = {
        @Index(name = "idx_flow_nodes_flow", columnList = "flow_id")
})
@Data
public class FlowNode {

    @Id
    private UUID id;

    @Column(name = "flow_id", nullable = false)
    private UUID flowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false)
    private NodeType nodeType;

    // Normalised type-specific payload, always written through the node type registry
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> payload;

    // Canvas position
    @Column(name = "position_x")
    private Double positionX;

    @Column(name = "position_y")
    private Double positionY;

    @Version
    private Long version;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @JsonIgnore
    public boolean isDeleted() {
        return deletedAt != null;
    }

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
