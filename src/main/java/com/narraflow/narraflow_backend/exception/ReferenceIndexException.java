package com.narraflow.narraflow_backend.exception;

/** The variable catalog could not be reached, so references cannot be derived. */
public class ReferenceIndexException extends FlowGraphException {

    public static final String CODE = "REFERENCE_INDEX_FAILURE";

    public ReferenceIndexException(String message, Throwable cause) {
        super(message, null, CODE, cause);
    }
}
