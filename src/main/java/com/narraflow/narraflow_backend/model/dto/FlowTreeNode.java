package com.narraflow.narraflow_backend.model.dto;

import java.util.List;
import java.util.UUID;

public record FlowTreeNode(
    UUID id,
    String name,
    String shortcut,
    int position,
    boolean main,
    List<FlowTreeNode> children
) {}
