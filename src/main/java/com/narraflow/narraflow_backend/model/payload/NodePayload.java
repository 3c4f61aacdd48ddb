package com.narraflow.narraflow_backend.model.payload;

import com.narraflow.narraflow_backend.model.domain.NodeType;

import java.util.List;

/**
 * Typed view of a node's JSON payload. Each node type has exactly one record; the registry
 * converts between the stored map and these records.
 */
public sealed interface NodePayload
        permits EntryPayload, ExitPayload, DialoguePayload, ConditionPayload, InstructionPayload,
                HubPayload, JumpPayload, ScenePayload, SubflowPayload {

    NodeType type();

    /** Variable-bearing fields of this payload. Incomplete rules and assignments yield nothing. */
    default List<VariableUse> variableUses() {
        return List.of();
    }

    /** One-line text shown on the canvas and in usage listings. */
    default String summary() {
        return "";
    }

    /**
     * Returns a copy where every use of {@code fromSheet.fromVariable} points at
     * {@code toSheet.toVariable}. Payloads without variable fields return themselves.
     */
    default NodePayload renameVariable(String fromSheet, String fromVariable, String toSheet, String toVariable) {
        return this;
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
