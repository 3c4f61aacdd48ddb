package com.narraflow.narraflow_backend.exception;

import java.util.UUID;

public class LockRequiredException extends FlowGraphException {

    public static final String CODE = "LOCK_REQUIRED";

    public LockRequiredException(UUID nodeId, String sessionId) {
        super("Session " + sessionId + " does not hold the edit lock on node " + nodeId,
                nodeId.toString(), CODE);
    }
}
