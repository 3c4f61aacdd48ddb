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
@Table(name = "flows", indexes = {
        @Index(name = "idx_flows_project_parent", columnList = "project_id, parent_id")
})
@Data
public class Flow {

    @Id
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(nullable = false)
    private String name;

    /** Slug derived from the name (e.g. "act-one"), unique per project among live flows. */
    @Column(nullable = false)
    private String shortcut = "";

    // Organisational tree only; a flow's graph never depends on its parent
    @Column(name = "parent_id")
    private UUID parentId;

    @Column(name = "sort_position", nullable = false)
    private int position;

    // Canvas viewport: {"x": .., "y": .., "zoom": ..}
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> viewport;

    @Column(name = "is_main", nullable = false)
    private boolean main;

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
