package com.narraflow.narraflow_backend.expression;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kind of a sheet variable, as reported by the variable catalog. */
public enum VariableKind {
    NUMBER,
    BOOLEAN,
    TEXT,
    SELECT,
    MULTI_SELECT,
    DATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VariableKind fromWire(String value) {
        return VariableKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
