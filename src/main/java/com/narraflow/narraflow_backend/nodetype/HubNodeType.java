package com.narraflow.narraflow_backend.nodetype;

import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.payload.HubPayload;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
class HubNodeType extends TypedNodeTypeHandler<HubPayload> {

    private static final Pattern HUB_ID = Pattern.compile("^[A-Za-z0-9_.-]+$");

    HubNodeType() {
        super(NodeType.HUB, HubPayload.class);
    }

    // Blank id: FlowGraphService assigns the next free hub_N on creation
    @Override
    public HubPayload defaultPayload() {
        return new HubPayload("", "", null);
    }

    @Override
    protected HubPayload normalizeTyped(HubPayload payload) {
        if (!payload.hubId().isEmpty() && !HUB_ID.matcher(payload.hubId()).matches()) {
            throw violation("hub_id may only contain letters, digits, '_', '-' and '.', got '" + payload.hubId() + "'");
        }
        return payload;
    }
}
