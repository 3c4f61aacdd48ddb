package com.narraflow.narraflow_backend.model.dto;

import java.util.UUID;

public record LockMessage(UUID nodeId) {}
