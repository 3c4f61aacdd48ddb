package com.narraflow.narraflow_backend.model.collab;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/** Client-facing form of an {@link EditLease}. */
public record LeaseView(@JsonProperty("node_id") UUID nodeId,
                        @JsonProperty("session_id") String sessionId,
                        @JsonProperty("holder") SessionUser holder,
                        @JsonProperty("expires_in_ms") long expiresInMs) {
}
