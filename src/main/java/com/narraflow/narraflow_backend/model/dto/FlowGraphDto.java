package com.narraflow.narraflow_backend.model.dto;

import com.narraflow.narraflow_backend.model.domain.Flow;
import com.narraflow.narraflow_backend.model.domain.FlowConnection;
import com.narraflow.narraflow_backend.model.domain.FlowNode;

import java.util.List;

/** A flow with its live nodes and connections, as loaded by the canvas. */
public record FlowGraphDto(
    Flow flow,
    List<FlowNode> nodes,
    List<FlowConnection> connections
) {}
