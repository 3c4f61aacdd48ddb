package com.narraflow.narraflow_backend.catalog;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only lookup of sheet variables. Implementations throw
 * {@link com.narraflow.narraflow_backend.exception.ReferenceIndexException} when the catalog
 * cannot be reached; a variable that does not exist is an empty result, not an error.
 */
public interface VariableCatalog {

    Optional<VariableDescriptor> resolve(UUID projectId, String sheetShortcut, String variableName);

    Optional<VariableDescriptor> findById(UUID projectId, String variableId);
}
