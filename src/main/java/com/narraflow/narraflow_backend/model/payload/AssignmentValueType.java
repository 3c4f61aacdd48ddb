package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AssignmentValueType {
    LITERAL,
    // value holds a variable name, value_sheet its sheet
    VARIABLE_REF;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
