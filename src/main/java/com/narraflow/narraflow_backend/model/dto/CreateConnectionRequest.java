package com.narraflow.narraflow_backend.model.dto;

import java.util.UUID;

/** Pins default to "output" and "input" when absent. */
public record CreateConnectionRequest(
    UUID id,
    UUID sourceNodeId,
    String sourcePin,
    UUID targetNodeId,
    String targetPin,
    String label
) {}
