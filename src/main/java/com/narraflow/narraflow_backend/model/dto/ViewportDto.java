package com.narraflow.narraflow_backend.model.dto;

public record ViewportDto(
    Double x,
    Double y,
    Double zoom
) {}
