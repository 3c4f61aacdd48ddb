package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.model.domain.NodeType;

import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScenePayload(@JsonProperty("location") String location,
                           @JsonProperty("int_ext") IntExt intExt,
                           @JsonProperty("time_of_day") String timeOfDay,
                           @JsonProperty("description") String description) implements NodePayload {

    @Override
    public NodeType type() {
        return NodeType.SCENE;
    }

    /** Slug line, e.g. "INT. TAVERN - NIGHT". */
    @Override
    public String summary() {
        StringBuilder slug = new StringBuilder();
        if (intExt != null) {
            slug.append(intExt.name()).append(". ");
        }
        if (NodePayload.hasText(location)) {
            slug.append(location.trim().toUpperCase(Locale.ROOT));
        }
        if (NodePayload.hasText(timeOfDay)) {
            slug.append(" - ").append(timeOfDay.trim().toUpperCase(Locale.ROOT));
        }
        return slug.toString().trim();
    }
}
