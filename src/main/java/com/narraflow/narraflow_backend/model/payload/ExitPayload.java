package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.model.domain.NodeType;

import java.util.List;

/**
 * Exit of a flow. In {@link ExitMode#FLOW_REFERENCE} mode the story continues in
 * {@code referencedFlowId}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExitPayload(@JsonProperty("label") String label,
                          @JsonProperty("technical_id") String technicalId,
                          @JsonProperty("outcome_tags") List<String> outcomeTags,
                          @JsonProperty("outcome_color") String outcomeColor,
                          @JsonProperty(value = "exit_mode", required = true) ExitMode exitMode,
                          @JsonProperty("referenced_flow_id") String referencedFlowId) implements NodePayload {

    public ExitPayload {
        outcomeTags = outcomeTags == null ? List.of() : List.copyOf(outcomeTags);
    }

    @Override
    public NodeType type() {
        return NodeType.EXIT;
    }

    @Override
    public String summary() {
        return NodePayload.hasText(label) ? label : "Exit";
    }
}
