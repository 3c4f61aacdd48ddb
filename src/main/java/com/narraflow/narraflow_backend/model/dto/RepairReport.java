package com.narraflow.narraflow_backend.model.dto;

import java.util.List;
import java.util.UUID;

/** Nodes whose stale references were rewritten, and nodes skipped because someone was editing them. */
public record RepairReport(
    String variableId,
    List<UUID> repairedNodeIds,
    List<UUID> skippedNodeIds
) {}
