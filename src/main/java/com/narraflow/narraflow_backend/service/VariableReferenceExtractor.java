package com.narraflow.narraflow_backend.service;

import com.narraflow.narraflow_backend.model.payload.NodePayload;
import com.narraflow.narraflow_backend.model.payload.VariableUse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls textual variable uses out of a payload. Pure: no catalog or database access.
 * Condition rules are reads; instruction targets are writes, and a variable_ref source is a read.
 */
@Component
public class VariableReferenceExtractor {

    public List<VariableUse> extract(NodePayload payload) {
        if (payload == null) {
            return List.of();
        }
        // The same sheet.variable may appear in several rules; keep the first use of each kind
        Set<String> seen = new HashSet<>();
        List<VariableUse> uses = new ArrayList<>();
        for (VariableUse use : payload.variableUses()) {
            if (seen.add(use.qualifiedName() + "|" + use.kind())) {
                uses.add(use);
            }
        }
        return uses;
    }
}
