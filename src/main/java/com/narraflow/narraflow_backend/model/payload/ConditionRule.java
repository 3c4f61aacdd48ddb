package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.expression.ConditionOperator;

/** A single comparison. {@code sheet}/{@code variable} may still be empty while the user is editing. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionRule(@JsonProperty("id") String id,
                            @JsonProperty("sheet") String sheet,
                            @JsonProperty("variable") String variable,
                            @JsonProperty(value = "operator", required = true) ConditionOperator operator,
                            @JsonProperty("value") String value) {

    public boolean complete() {
        return NodePayload.hasText(sheet) && NodePayload.hasText(variable) && operator != null;
    }

    public boolean references(String otherSheet, String otherVariable) {
        return complete() && sheet.equals(otherSheet) && variable.equals(otherVariable);
    }

    public ConditionRule withVariable(String newSheet, String newVariable) {
        return new ConditionRule(id, newSheet, newVariable, operator, value);
    }
}
