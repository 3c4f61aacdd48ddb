package com.narraflow.narraflow_backend.model.dto;

import java.util.UUID;

public record HubSummary(
    UUID nodeId,
    String hubId,
    String label,
    String color
) {}
