package com.narraflow.narraflow_backend.model.collab;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.UUID;

/**
 * Message broadcast to every observer of a flow. {@code sequence} increases by one per event
 * within a flow session; 0 means the event was emitted while nobody had the flow open.
 */
public record FlowEvent(@JsonProperty("type") FlowEventType type,
                        @JsonProperty("flow_id") UUID flowId,
                        @JsonProperty("sequence") long sequence,
                        @JsonProperty("payload") Map<String, Object> payload) {
}
