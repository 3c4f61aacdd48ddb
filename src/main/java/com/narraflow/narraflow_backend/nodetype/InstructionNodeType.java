package com.narraflow.narraflow_backend.nodetype;

import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.payload.Assignment;
import com.narraflow.narraflow_backend.model.payload.AssignmentValueType;
import com.narraflow.narraflow_backend.model.payload.InstructionPayload;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
class InstructionNodeType extends TypedNodeTypeHandler<InstructionPayload> {

    InstructionNodeType() {
        super(NodeType.INSTRUCTION, InstructionPayload.class);
    }

    @Override
    public InstructionPayload defaultPayload() {
        return new InstructionPayload(List.of());
    }

    /*
     * set_true / set_false / toggle / clear must not carry a value, value_type or value_sheet,
     * not even an empty one. Other operators default to a literal value.
     */
    @Override
    protected InstructionPayload normalizeTyped(InstructionPayload payload) {
        List<Assignment> assignments = required(payload.assignments(), "assignments");

        List<Assignment> normalized = new ArrayList<>(assignments.size());
        for (Assignment assignment : assignments) {
            required(assignment, "assignment");
            required(assignment.operator(), "assignment operator");
            Assignment trimmed = assignment.withTarget(trim(assignment.sheet()), trim(assignment.variable()));

            if (!assignment.operator().takesValue()) {
                if (assignment.value() != null || assignment.valueType() != null || assignment.valueSheet() != null) {
                    throw violation("operator " + assignment.operator().wireName()
                            + " takes no value, value_type or value_sheet");
                }
                normalized.add(trimmed.withoutValue());
                continue;
            }
            AssignmentValueType valueType = assignment.valueType() != null
                    ? assignment.valueType()
                    : AssignmentValueType.LITERAL;
            String valueSheet = valueType == AssignmentValueType.VARIABLE_REF ? trim(assignment.valueSheet()) : null;
            normalized.add(new Assignment(assignment.id(), trimmed.sheet(), trimmed.variable(),
                    assignment.operator(), valueType, assignment.value(), valueSheet));
        }
        return new InstructionPayload(List.copyOf(normalized));
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
