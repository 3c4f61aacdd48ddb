package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.expression.InstructionOperator;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Assignment(@JsonProperty("id") String id,
                         @JsonProperty("sheet") String sheet,
                         @JsonProperty("variable") String variable,
                         @JsonProperty(value = "operator", required = true) InstructionOperator operator,
                         @JsonProperty("value_type") AssignmentValueType valueType,
                         @JsonProperty("value") String value,
                         @JsonProperty("value_sheet") String valueSheet) {

    public boolean complete() {
        return NodePayload.hasText(sheet) && NodePayload.hasText(variable) && operator != null;
    }

    public boolean readsVariable() {
        return valueType == AssignmentValueType.VARIABLE_REF
                && NodePayload.hasText(valueSheet)
                && NodePayload.hasText(value);
    }

    public Assignment withTarget(String newSheet, String newVariable) {
        return new Assignment(id, newSheet, newVariable, operator, valueType, value, valueSheet);
    }

    public Assignment withSource(String newSheet, String newVariable) {
        return new Assignment(id, sheet, variable, operator, valueType, newVariable, newSheet);
    }

    /** Copy without value slots, for operators that take no value. */
    public Assignment withoutValue() {
        return new Assignment(id, sheet, variable, operator, null, null, null);
    }
}
