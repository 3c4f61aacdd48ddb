package com.narraflow.narraflow_backend.exception;

import java.util.UUID;

public class SessionNotJoinedException extends FlowGraphException {

    public static final String CODE = "SESSION_NOT_JOINED";

    public SessionNotJoinedException(UUID flowId, String sessionId) {
        super("Session " + sessionId + " has not joined flow " + flowId, flowId.toString(), CODE);
    }
}
