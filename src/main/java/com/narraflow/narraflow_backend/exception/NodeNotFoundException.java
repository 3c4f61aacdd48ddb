package com.narraflow.narraflow_backend.exception;

import java.util.UUID;

public class NodeNotFoundException extends FlowGraphException {

    public static final String CODE = "NOT_FOUND";

    public NodeNotFoundException(UUID nodeId) {
        super("Node not found: " + nodeId, nodeId.toString(), CODE);
    }
}
