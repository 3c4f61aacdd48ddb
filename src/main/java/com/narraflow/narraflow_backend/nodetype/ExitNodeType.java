package com.narraflow.narraflow_backend.nodetype;

import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.payload.ExitMode;
import com.narraflow.narraflow_backend.model.payload.ExitPayload;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
class ExitNodeType extends TypedNodeTypeHandler<ExitPayload> {

    ExitNodeType() {
        super(NodeType.EXIT, ExitPayload.class);
    }

    @Override
    public ExitPayload defaultPayload() {
        return new ExitPayload("", null, List.of(), null, ExitMode.TERMINAL, null);
    }

    @Override
    protected ExitPayload normalizeTyped(ExitPayload payload) {
        ExitMode mode = required(payload.exitMode(), "exit_mode");
        checkHexColor(payload.outcomeColor(), "outcome_color");

        Set<String> tags = new LinkedHashSet<>();
        for (String tag : payload.outcomeTags()) {
            if (tag != null && !tag.isBlank()) tags.add(tag.trim());
        }
        // A terminal exit never points anywhere
        String referenced = mode == ExitMode.FLOW_REFERENCE
                ? flowIdOrNull(payload.referencedFlowId(), "referenced_flow_id")
                : null;

        return new ExitPayload(payload.label(), blankToNull(payload.technicalId()), List.copyOf(tags),
                payload.outcomeColor(), mode, referenced);
    }
}
