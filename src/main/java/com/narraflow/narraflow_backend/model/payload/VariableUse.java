package com.narraflow.narraflow_backend.model.payload;

import com.narraflow.narraflow_backend.expression.VariableKind;
import com.narraflow.narraflow_backend.model.domain.ReferenceKind;

import java.util.Set;

/**
 * A textual variable reference found in a payload, before it is resolved against the catalog.
 *
 * @param operator     wire name of the operator, for error messages
 * @param allowedKinds variable kinds the operator accepts
 */
public record VariableUse(String sheet,
                          String variable,
                          ReferenceKind kind,
                          String operator,
                          Set<VariableKind> allowedKinds) {

    public String qualifiedName() {
        return sheet + "." + variable;
    }

    public boolean matches(String otherSheet, String otherVariable) {
        return sheet.equals(otherSheet) && variable.equals(otherVariable);
    }
}
