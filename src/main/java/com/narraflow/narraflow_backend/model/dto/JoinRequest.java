package com.narraflow.narraflow_backend.model.dto;

/** Who is joining a flow over the realtime channel. All fields optional. */
public record JoinRequest(
    String userId,
    String displayName,
    String color
) {}
