package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.expression.AssignmentFormatter;
import com.narraflow.narraflow_backend.expression.VariableKind;
import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.domain.ReferenceKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstructionPayload(@JsonProperty(value = "assignments", required = true) List<Assignment> assignments)
        implements NodePayload {

    @Override
    public NodeType type() {
        return NodeType.INSTRUCTION;
    }

    @Override
    public List<VariableUse> variableUses() {
        List<VariableUse> uses = new ArrayList<>();
        for (Assignment assignment : assignments) {
            if (!assignment.complete()) continue;
            String operator = assignment.operator().wireName();
            uses.add(new VariableUse(assignment.sheet(), assignment.variable(), ReferenceKind.WRITE,
                    operator, assignment.operator().kinds()));
            if (assignment.readsVariable()) {
                uses.add(new VariableUse(assignment.valueSheet(), assignment.value(), ReferenceKind.READ,
                        operator, EnumSet.allOf(VariableKind.class)));
            }
        }
        return uses;
    }

    @Override
    public String summary() {
        return assignments.stream()
                .map(AssignmentFormatter::formatAssignmentShort)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining("; "));
    }

    @Override
    public NodePayload renameVariable(String fromSheet, String fromVariable, String toSheet, String toVariable) {
        List<Assignment> renamed = new ArrayList<>(assignments.size());
        for (Assignment assignment : assignments) {
            Assignment next = assignment;
            if (next.complete() && next.sheet().equals(fromSheet) && next.variable().equals(fromVariable)) {
                next = next.withTarget(toSheet, toVariable);
            }
            if (next.readsVariable() && next.valueSheet().equals(fromSheet) && next.value().equals(fromVariable)) {
                next = next.withSource(toSheet, toVariable);
            }
            renamed.add(next);
        }
        return Objects.equals(renamed, assignments) ? this : new InstructionPayload(List.copyOf(renamed));
    }
}
