package com.narraflow.narraflow_backend.model.dto;

import com.narraflow.narraflow_backend.model.domain.FlowNode;

import java.util.List;

/** The updated node plus jumps retargeted by a hub rename. */
public record PayloadUpdate(
    FlowNode node,
    List<FlowNode> updatedJumps
) {}
