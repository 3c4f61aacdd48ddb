package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IntExt {
    INT,
    EXT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
