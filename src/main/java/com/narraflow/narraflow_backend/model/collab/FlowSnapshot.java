package com.narraflow.narraflow_backend.model.collab;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.model.dto.FlowGraphDto;

import java.util.List;

/**
 * State handed to a session when it joins a flow. Every event up to {@code sequence} is
 * reflected in the graph; later events may be too, and re-applying them is harmless.
 */
public record FlowSnapshot(@JsonProperty("graph") FlowGraphDto graph,
                           @JsonProperty("locks") List<LeaseView> locks,
                           @JsonProperty("presence") List<PresenceView> presence,
                           @JsonProperty("sequence") long sequence) {
}
