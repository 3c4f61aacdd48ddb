package com.narraflow.narraflow_backend.catalog;

import com.narraflow.narraflow_backend.expression.VariableKind;

/**
 * A variable defined in a data sheet, as known to the sheet service.
 *
 * @param id            stable id; survives renames of the sheet or the variable
 * @param sheetShortcut current shortcut of the owning sheet, e.g. "mc.jaime"
 * @param variableName  current name within the sheet, e.g. "health"
 */
public record VariableDescriptor(String id, String sheetShortcut, String variableName, VariableKind kind) {

    public boolean isNamed(String sheet, String variable) {
        return sheetShortcut.equals(sheet) && variableName.equals(variable);
    }
}
