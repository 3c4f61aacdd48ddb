package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A player choice; its {@code id} doubles as the output pin of the dialogue node. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DialogueResponse(@JsonProperty(value = "id", required = true) String id,
                               @JsonProperty("text") String text) {
}
