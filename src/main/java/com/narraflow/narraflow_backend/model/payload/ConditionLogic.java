package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConditionLogic {
    ALL(" AND "),
    ANY(" OR ");

    private final String joiner;

    ConditionLogic(String joiner) {
        this.joiner = joiner;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String joiner() {
        return joiner;
    }
}
