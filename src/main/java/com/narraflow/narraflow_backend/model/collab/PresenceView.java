package com.narraflow.narraflow_backend.model.collab;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresenceView(@JsonProperty("session_id") String sessionId,
                           @JsonProperty("user") SessionUser user,
                           @JsonProperty("x") Double x,
                           @JsonProperty("y") Double y) {
}
