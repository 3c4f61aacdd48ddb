package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.model.domain.NodeType;

/** Jumps to the hub of the same flow whose {@code hub_id} equals {@code targetHubId}; empty means unset. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JumpPayload(@JsonProperty("target_hub_id") String targetHubId,
                          @JsonProperty("label") String label) implements NodePayload {

    public JumpPayload {
        targetHubId = targetHubId == null ? "" : targetHubId.trim();
    }

    @Override
    public NodeType type() {
        return NodeType.JUMP;
    }

    @Override
    public String summary() {
        if (NodePayload.hasText(label)) return label;
        return NodePayload.hasText(targetHubId) ? "→ " + targetHubId : "";
    }

    public boolean hasTarget() {
        return NodePayload.hasText(targetHubId);
    }

    public JumpPayload withTarget(String hubId) {
        return new JumpPayload(hubId, label);
    }
}
