package com.narraflow.narraflow_backend.catalog;

import com.narraflow.narraflow_backend.exception.ReferenceIndexException;
import com.narraflow.narraflow_backend.expression.VariableKind;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Sheet variables held in memory, standing in for the sheet service in tests. */
public class InMemoryVariableCatalog implements VariableCatalog {

    private final Map<String, Defined> variables = new ConcurrentHashMap<>();
    private volatile boolean unavailable;

    public VariableDescriptor define(UUID projectId, String id, String sheet, String name, VariableKind kind) {
        VariableDescriptor descriptor = new VariableDescriptor(id, sheet, name, kind);
        variables.put(id, new Defined(projectId, descriptor));
        return descriptor;
    }

    public void rename(String id, String sheet, String name) {
        Defined current = variables.get(id);
        VariableDescriptor old = current.descriptor();
        variables.put(id, new Defined(current.projectId(), new VariableDescriptor(id, sheet, name, old.kind())));
    }

    public void remove(String id) {
        variables.remove(id);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void clear() {
        variables.clear();
        unavailable = false;
    }

    @Override
    public Optional<VariableDescriptor> resolve(UUID projectId, String sheetShortcut, String variableName) {
        checkAvailable();
        return variables.values().stream()
                .filter(defined -> defined.projectId().equals(projectId))
                .map(Defined::descriptor)
                .filter(descriptor -> descriptor.isNamed(sheetShortcut, variableName))
                .findFirst();
    }

    @Override
    public Optional<VariableDescriptor> findById(UUID projectId, String variableId) {
        checkAvailable();
        return Optional.ofNullable(variables.get(variableId))
                .filter(defined -> defined.projectId().equals(projectId))
                .map(Defined::descriptor);
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new ReferenceIndexException("Sheet service unavailable", new IllegalStateException("connection refused"));
        }
    }

    private record Defined(UUID projectId, VariableDescriptor descriptor) {
    }
}
