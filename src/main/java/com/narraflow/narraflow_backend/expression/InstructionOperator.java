package com.narraflow.narraflow_backend.expression;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static com.narraflow.narraflow_backend.expression.VariableKind.*;

/**
 * Write operators usable in instruction assignments. Multi-select variables have no write
 * operator.
 */
public enum InstructionOperator {
    SET("=", true, EnumSet.of(NUMBER, TEXT, SELECT, DATE)),
    ADD("+=", true, EnumSet.of(NUMBER)),
    SUBTRACT("-=", true, EnumSet.of(NUMBER)),
    SET_TRUE("= true", false, EnumSet.of(BOOLEAN)),
    SET_FALSE("= false", false, EnumSet.of(BOOLEAN)),
    TOGGLE("toggle", false, EnumSet.of(BOOLEAN)),
    CLEAR("clear", false, EnumSet.of(TEXT));

    private final String symbol;
    private final boolean takesValue;
    private final Set<VariableKind> kinds;

    InstructionOperator(String symbol, boolean takesValue, Set<VariableKind> kinds) {
        this.symbol = symbol;
        this.takesValue = takesValue;
        this.kinds = kinds;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String symbol() {
        return symbol;
    }

    /** {@code false} for set_true, set_false, toggle and clear. */
    public boolean takesValue() {
        return takesValue;
    }

    public Set<VariableKind> kinds() {
        return kinds;
    }

    public boolean appliesTo(VariableKind kind) {
        return kinds.contains(kind);
    }

    public static Set<InstructionOperator> forKind(VariableKind kind) {
        Set<InstructionOperator> result = EnumSet.noneOf(InstructionOperator.class);
        for (InstructionOperator op : values()) {
            if (op.appliesTo(kind)) result.add(op);
        }
        return result;
    }
}
