package com.narraflow.narraflow_backend.model.dto;

public record UsageCount(
    long read,
    long write
) {}
