package com.narraflow.narraflow_backend.model.dto;

import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.domain.ReferenceKind;

import java.util.UUID;

/** One node that reads or writes a variable. {@code link} opens the node in the editor. */
public record VariableUsageEntry(
    UUID flowId,
    String flowName,
    String flowShortcut,
    UUID nodeId,
    NodeType nodeType,
    ReferenceKind kind,
    String summary,
    String link,
    String sourceSheet,
    String sourceVariable,
    boolean stale
) {
    public VariableUsageEntry markStale(boolean isStale) {
        return new VariableUsageEntry(flowId, flowName, flowShortcut, nodeId, nodeType, kind, summary, link,
                sourceSheet, sourceVariable, isStale);
    }
}
