package com.narraflow.narraflow_backend.model.dto;

import com.narraflow.narraflow_backend.model.domain.FlowConnection;
import com.narraflow.narraflow_backend.model.domain.FlowNode;

import java.util.List;

/**
 * Outcome of a node deletion: the removed connections and the jumps whose target was cleared.
 * {@code alreadyDeleted} is true for a retried delete that changed nothing.
 */
public record NodeDeletion(
    FlowNode node,
    List<FlowConnection> removedConnections,
    List<FlowNode> updatedJumps,
    boolean alreadyDeleted
) {}
