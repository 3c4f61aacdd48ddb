package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.expression.AssignmentFormatter;
import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.domain.ReferenceKind;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionPayload(@JsonProperty(value = "logic", required = true) ConditionLogic logic,
                               @JsonProperty(value = "rules", required = true) List<ConditionRule> rules)
        implements NodePayload {

    @Override
    public NodeType type() {
        return NodeType.CONDITION;
    }

    @Override
    public List<VariableUse> variableUses() {
        return rules.stream()
                .filter(ConditionRule::complete)
                .map(rule -> new VariableUse(rule.sheet(), rule.variable(), ReferenceKind.READ,
                        rule.operator().wireName(), rule.operator().kinds()))
                .toList();
    }

    @Override
    public String summary() {
        return rules.stream()
                .map(AssignmentFormatter::formatRuleShort)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining(logic.joiner()));
    }

    @Override
    public NodePayload renameVariable(String fromSheet, String fromVariable, String toSheet, String toVariable) {
        List<ConditionRule> renamed = rules.stream()
                .map(rule -> rule.references(fromSheet, fromVariable) ? rule.withVariable(toSheet, toVariable) : rule)
                .toList();
        return Objects.equals(renamed, rules) ? this : new ConditionPayload(logic, renamed);
    }
}
