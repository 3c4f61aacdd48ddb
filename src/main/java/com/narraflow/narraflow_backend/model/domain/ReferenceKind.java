package com.narraflow.narraflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Whether a node reads a variable (condition) or writes it (instruction). */
public enum ReferenceKind {
    READ,
    WRITE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
