package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.model.domain.NodeType;

/** Named convergence point. A blank {@code hubId} is only accepted on creation, where one is generated. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HubPayload(@JsonProperty("hub_id") String hubId,
                         @JsonProperty("label") String label,
                         @JsonProperty("color") String color) implements NodePayload {

    public HubPayload {
        hubId = hubId == null ? "" : hubId.trim();
    }

    @Override
    public NodeType type() {
        return NodeType.HUB;
    }

    @Override
    public String summary() {
        return NodePayload.hasText(label) ? label : hubId;
    }

    public HubPayload withHubId(String newHubId) {
        return new HubPayload(newHubId, label, color);
    }
}
