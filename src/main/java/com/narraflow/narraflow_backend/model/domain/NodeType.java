package com.narraflow.narraflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeType {
    ENTRY,        // exactly one per flow, created with the flow
    EXIT,         // terminal, or hands off to another flow
    DIALOGUE,
    CONDITION,    // reads variables
    INSTRUCTION,  // writes variables
    HUB,          // named convergence point, target of jumps
    JUMP,
    SCENE,        // screenplay slug line
    SUBFLOW;

    /** Wire name used by clients and in event payloads, e.g. "dialogue". */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node type is required");
        }
        return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
