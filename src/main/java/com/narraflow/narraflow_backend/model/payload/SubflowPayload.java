package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.model.domain.NodeType;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubflowPayload(@JsonProperty("referenced_flow_id") String referencedFlowId,
                             @JsonProperty("label") String label) implements NodePayload {

    @Override
    public NodeType type() {
        return NodeType.SUBFLOW;
    }

    @Override
    public String summary() {
        return NodePayload.hasText(label) ? label : "";
    }
}
