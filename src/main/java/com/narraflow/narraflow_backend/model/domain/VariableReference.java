package com.narraflow.narraflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of the derived dependency index: node {@code flowNodeId} reads or writes variable
 * {@code variableId}. Rows are never edited; they are replaced whenever the node's payload is.
 */
@Entity
@Table(name = "variable_references",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_variable_references_node_variable_kind",
                columnNames = {"flow_node_id", "variable_id", "kind"}),
        indexes = {
                @Index(name = "idx_variable_references_variable", columnList = "variable_id"),
                @Index(name = "idx_variable_references_flow", columnList = "flow_id")
        })
@Data
public class VariableReference {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "flow_id", nullable = false)
    private UUID flowId;

    @Column(name = "flow_node_id", nullable = false)
    private UUID flowNodeId;

    @Column(name = "variable_id", nullable = false)
    private String variableId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReferenceKind kind;

    // Textual identity at derivation time; compared with the catalog to detect renames
    @Column(name = "source_sheet")
    private String sourceSheet;

    @Column(name = "source_variable")
    private String sourceVariable;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();
}
