package com.narraflow.narraflow_backend.exception;

import com.narraflow.narraflow_backend.model.collab.EditLease;

import java.util.UUID;

/** Another session holds a live lease on the node. */
public class LockConflictException extends FlowGraphException {

    public static final String CODE = "LOCK_CONFLICT";

    private final transient EditLease heldLease;

    public LockConflictException(UUID nodeId, EditLease heldLease) {
        super("Node " + nodeId + " is being edited by " + heldLease.holder().displayName(),
                nodeId.toString(), CODE);
        this.heldLease = heldLease;
    }

    public EditLease getHeldLease() {
        return heldLease;
    }
}
