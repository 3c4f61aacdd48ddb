package com.narraflow.narraflow_backend.model.dto;

import java.util.UUID;

/**
 * Request body for POST /api/projects/{projectId}/flows.
 * {@code id} is optional; a retry with the same id returns the flow created the first time.
 */
public record CreateFlowRequest(
    UUID id,
    String name,
    UUID parentId,
    Integer position,
    String shortcut,
    Boolean main
) {}
