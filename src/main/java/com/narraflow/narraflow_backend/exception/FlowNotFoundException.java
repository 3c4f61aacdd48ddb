package com.narraflow.narraflow_backend.exception;

import java.util.UUID;

public class FlowNotFoundException extends FlowGraphException {

    public static final String CODE = "NOT_FOUND";

    public FlowNotFoundException(UUID flowId) {
        super("Flow not found: " + flowId, flowId.toString(), CODE);
    }
}
