package com.narraflow.narraflow_backend.expression;

import com.narraflow.narraflow_backend.model.payload.Assignment;
import com.narraflow.narraflow_backend.model.payload.AssignmentValueType;
import com.narraflow.narraflow_backend.model.payload.ConditionRule;
import com.narraflow.narraflow_backend.model.payload.NodePayload;

/**
 * Short human-readable renderings of assignments and rules. The same strings are used for the
 * live preview in the editor and for the node summary on the canvas.
 *
 * <pre>
 *   add       mc.jaime.health 10  →  "mc.jaime.health += 10"
 *   set_true  mc.zelda.hasMasterSword  →  "mc.zelda.hasMasterSword = true"
 *   toggle    mc.link.awake  →  "toggle mc.link.awake"
 * </pre>
 */
public final class AssignmentFormatter {

    static final String MISSING_VALUE = "?";

    private AssignmentFormatter() {
    }

    /** Returns an empty string when the assignment has no complete target yet. */
    public static String formatAssignmentShort(Assignment assignment) {
        if (assignment == null || !assignment.complete()) {
            return "";
        }
        String ref = assignment.sheet() + "." + assignment.variable();
        return switch (assignment.operator()) {
            case SET_TRUE -> ref + " = true";
            case SET_FALSE -> ref + " = false";
            case TOGGLE -> "toggle " + ref;
            case CLEAR -> "clear " + ref;
            case SET, ADD, SUBTRACT -> ref + " " + assignment.operator().symbol() + " " + valueText(assignment);
        };
    }

    public static String formatRuleShort(ConditionRule rule) {
        if (rule == null || !rule.complete()) {
            return "";
        }
        String ref = rule.sheet() + "." + rule.variable();
        ConditionOperator operator = rule.operator();
        if (!operator.takesValue()) {
            return ref + " " + operator.label();
        }
        String value = NodePayload.hasText(rule.value()) ? rule.value() : MISSING_VALUE;
        return ref + " " + operator.label() + " " + value;
    }

    private static String valueText(Assignment assignment) {
        if (assignment.valueType() == AssignmentValueType.VARIABLE_REF) {
            return assignment.readsVariable()
                    ? assignment.valueSheet() + "." + assignment.value()
                    : MISSING_VALUE;
        }
        return NodePayload.hasText(assignment.value()) ? assignment.value() : MISSING_VALUE;
    }
}
