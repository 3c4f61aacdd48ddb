package com.narraflow.narraflow_backend.expression;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static com.narraflow.narraflow_backend.expression.VariableKind.*;

/**
 * Comparison operators usable in condition rules. Each operator lists the variable kinds
 * it can be applied to and the label used in short summaries.
 */
public enum ConditionOperator {
    EQUALS("equals", true, EnumSet.of(NUMBER, TEXT, SELECT, DATE)),
    NOT_EQUALS("not equals", true, EnumSet.of(NUMBER, TEXT, SELECT, DATE)),
    GREATER_THAN(">", true, EnumSet.of(NUMBER)),
    GREATER_THAN_OR_EQUAL(">=", true, EnumSet.of(NUMBER)),
    LESS_THAN("<", true, EnumSet.of(NUMBER)),
    LESS_THAN_OR_EQUAL("<=", true, EnumSet.of(NUMBER)),
    CONTAINS("contains", true, EnumSet.of(TEXT, MULTI_SELECT)),
    NOT_CONTAINS("does not contain", true, EnumSet.of(MULTI_SELECT)),
    STARTS_WITH("starts with", true, EnumSet.of(TEXT)),
    ENDS_WITH("ends with", true, EnumSet.of(TEXT)),
    IS_EMPTY("is empty", false, EnumSet.of(TEXT, MULTI_SELECT)),
    IS_TRUE("is true", false, EnumSet.of(BOOLEAN)),
    IS_FALSE("is false", false, EnumSet.of(BOOLEAN)),
    IS_NIL("is not set", false, EnumSet.of(BOOLEAN, SELECT)),
    BEFORE("before", true, EnumSet.of(DATE)),
    AFTER("after", true, EnumSet.of(DATE));

    private final String label;
    private final boolean takesValue;
    private final Set<VariableKind> kinds;

    ConditionOperator(String label, boolean takesValue, Set<VariableKind> kinds) {
        this.label = label;
        this.takesValue = takesValue;
        this.kinds = kinds;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String label() {
        return label;
    }

    public boolean takesValue() {
        return takesValue;
    }

    public Set<VariableKind> kinds() {
        return kinds;
    }

    public boolean appliesTo(VariableKind kind) {
        return kinds.contains(kind);
    }

    public static Set<ConditionOperator> forKind(VariableKind kind) {
        Set<ConditionOperator> result = EnumSet.noneOf(ConditionOperator.class);
        for (ConditionOperator op : values()) {
            if (op.appliesTo(kind)) result.add(op);
        }
        return result;
    }
}
