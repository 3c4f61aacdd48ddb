package com.narraflow.narraflow_backend.service;

import com.narraflow.narraflow_backend.model.domain.ReferenceKind;

/** A variable use resolved against the catalog, ready to be stored as a reference row. */
public record DerivedReference(String variableId, ReferenceKind kind, String sourceSheet, String sourceVariable) {
}
