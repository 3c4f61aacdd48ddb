package com.narraflow.narraflow_backend.exception;

/**
 * Base class of every error raised by the flow graph engine. Carries a stable error code
 * for clients and the id of the entity involved, when there is one.
 */
public class FlowGraphException extends RuntimeException {

    private final String entityId;
    private final String errorCode;

    public FlowGraphException(String message, String entityId, String errorCode) {
        super(message);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public FlowGraphException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
