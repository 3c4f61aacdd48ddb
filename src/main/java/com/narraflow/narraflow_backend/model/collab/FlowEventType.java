package com.narraflow.narraflow_backend.model.collab;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FlowEventType {
    NODE_CREATED,
    NODE_UPDATED,
    NODE_DELETED,
    NODE_RESTORED,
    NODE_MOVED,
    CONNECTION_CREATED,
    CONNECTION_DELETED,
    NODE_LOCKED,
    NODE_UNLOCKED,
    PRESENCE_DIFF,
    CURSOR_MOVED,
    // graph changed in a way clients should reload (flow restored, trash purge, ...)
    FLOW_REFRESH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
