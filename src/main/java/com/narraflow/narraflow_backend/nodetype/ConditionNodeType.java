package com.narraflow.narraflow_backend.nodetype;

import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.payload.ConditionLogic;
import com.narraflow.narraflow_backend.model.payload.ConditionPayload;
import com.narraflow.narraflow_backend.model.payload.ConditionRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
class ConditionNodeType extends TypedNodeTypeHandler<ConditionPayload> {

    ConditionNodeType() {
        super(NodeType.CONDITION, ConditionPayload.class);
    }

    @Override
    public ConditionPayload defaultPayload() {
        return new ConditionPayload(ConditionLogic.ALL, List.of());
    }

    @Override
    protected ConditionPayload normalizeTyped(ConditionPayload payload) {
        ConditionLogic logic = required(payload.logic(), "logic");
        List<ConditionRule> rules = required(payload.rules(), "rules");

        List<ConditionRule> normalized = new ArrayList<>(rules.size());
        for (ConditionRule rule : rules) {
            required(rule, "rule");
            required(rule.operator(), "rule operator");
            // Operators such as is_true carry no operand
            String value = rule.operator().takesValue() ? rule.value() : null;
            normalized.add(new ConditionRule(rule.id(), trim(rule.sheet()), trim(rule.variable()),
                    rule.operator(), value));
        }
        return new ConditionPayload(logic, List.copyOf(normalized));
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
