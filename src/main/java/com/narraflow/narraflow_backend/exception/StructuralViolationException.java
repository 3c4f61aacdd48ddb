package com.narraflow.narraflow_backend.exception;

/** The operation would break a graph invariant (second entry, duplicate hub id, cycle, ...). */
public class StructuralViolationException extends FlowGraphException {

    public static final String CODE = "STRUCTURAL_VIOLATION";

    public StructuralViolationException(String message, Object entityId) {
        super(message, entityId != null ? entityId.toString() : null, CODE);
    }
}
