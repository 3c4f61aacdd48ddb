package com.narraflow.narraflow_backend.model.dto;

import java.util.UUID;

/** {@code parentId} null moves the flow to the project root; {@code position} null appends. */
public record MoveFlowRequest(
    UUID parentId,
    Integer position
) {}
