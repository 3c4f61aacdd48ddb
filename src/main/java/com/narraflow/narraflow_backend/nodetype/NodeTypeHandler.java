package com.narraflow.narraflow_backend.nodetype;

import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.payload.NodePayload;

public interface NodeTypeHandler {

    NodeType supportedType();

    Class<? extends NodePayload> payloadClass();

    // Payload given to a node created without one
    NodePayload defaultPayload();

    /**
     * Applies the type's rules that the JSON shape alone cannot express and returns the form
     * that gets stored. Throws {@code PayloadSchemaViolationException} on a violation.
     */
    NodePayload normalize(NodePayload payload);
}
