package com.narraflow.narraflow_backend.model.collab;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** The person behind a realtime session, as shown to other collaborators. */
public record SessionUser(@JsonProperty("user_id") String userId,
                          @JsonProperty("display_name") String displayName,
                          @JsonProperty("color") String color) {

    private static final List<String> PALETTE = List.of(
            "#ef4444", "#f97316", "#f59e0b", "#84cc16", "#22c55e", "#14b8a6",
            "#06b6d4", "#3b82f6", "#6366f1", "#8b5cf6", "#d946ef", "#ec4899");

    /** Fills in a display name and a stable per-user color when the client did not send them. */
    public static SessionUser of(String userId, String displayName, String color) {
        String id = userId == null || userId.isBlank() ? "anonymous" : userId.trim();
        String name = displayName == null || displayName.isBlank() ? id : displayName.trim();
        String resolvedColor = color == null || color.isBlank()
                ? PALETTE.get(Math.floorMod(id.hashCode(), PALETTE.size()))
                : color;
        return new SessionUser(id, name, resolvedColor);
    }
}
