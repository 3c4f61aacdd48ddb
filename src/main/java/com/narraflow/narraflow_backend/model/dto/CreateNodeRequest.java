package com.narraflow.narraflow_backend.model.dto;

import com.narraflow.narraflow_backend.model.domain.NodeType;

import java.util.Map;
import java.util.UUID;

/**
 * Request body for node creation. A null payload gets the type's default payload.
 */
public record CreateNodeRequest(
    UUID id,
    NodeType nodeType,
    Double positionX,
    Double positionY,
    Map<String, Object> payload
) {}
