package com.narraflow.narraflow_backend.model.dto;

import java.util.List;

public record VariableUsage(
    String variableId,
    List<VariableUsageEntry> reads,
    List<VariableUsageEntry> writes
) {}
