package com.narraflow.narraflow_backend.exception;

/** A node payload does not match its type's schema or uses an operator the variable's kind does not allow. */
public class PayloadSchemaViolationException extends FlowGraphException {

    public static final String CODE = "PAYLOAD_SCHEMA_VIOLATION";

    public PayloadSchemaViolationException(String message) {
        super(message, null, CODE);
    }

    public PayloadSchemaViolationException(String message, Object entityId) {
        super(message, entityId != null ? entityId.toString() : null, CODE);
    }

    public PayloadSchemaViolationException(String message, Throwable cause) {
        super(message, null, CODE, cause);
    }
}
