package com.narraflow.narraflow_backend.model.dto;

public record NodePositionRequest(
    Double x,
    Double y
) {}
