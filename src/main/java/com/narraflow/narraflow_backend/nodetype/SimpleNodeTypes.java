package com.narraflow.narraflow_backend.nodetype;

import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.payload.EntryPayload;
import com.narraflow.narraflow_backend.model.payload.IntExt;
import com.narraflow.narraflow_backend.model.payload.JumpPayload;
import com.narraflow.narraflow_backend.model.payload.ScenePayload;
import com.narraflow.narraflow_backend.model.payload.SubflowPayload;
import org.springframework.stereotype.Component;

// Node types whose payloads need little more than their JSON shape.
// Jump targets and subflow references are checked against the graph by FlowGraphService.

@Component
class EntryNodeType extends TypedNodeTypeHandler<EntryPayload> {
    EntryNodeType() { super(NodeType.ENTRY, EntryPayload.class); }

    @Override public EntryPayload defaultPayload() { return new EntryPayload(null); }
}

@Component
class SceneNodeType extends TypedNodeTypeHandler<ScenePayload> {
    SceneNodeType() { super(NodeType.SCENE, ScenePayload.class); }

    @Override public ScenePayload defaultPayload() { return new ScenePayload("", IntExt.INT, "", ""); }
}

@Component
class JumpNodeType extends TypedNodeTypeHandler<JumpPayload> {
    JumpNodeType() { super(NodeType.JUMP, JumpPayload.class); }

    @Override public JumpPayload defaultPayload() { return new JumpPayload("", null); }
}

@Component
class SubflowNodeType extends TypedNodeTypeHandler<SubflowPayload> {
    SubflowNodeType() { super(NodeType.SUBFLOW, SubflowPayload.class); }

    @Override public SubflowPayload defaultPayload() { return new SubflowPayload(null, null); }

    @Override
    protected SubflowPayload normalizeTyped(SubflowPayload payload) {
        return new SubflowPayload(flowIdOrNull(payload.referencedFlowId(), "referenced_flow_id"), payload.label());
    }
}
