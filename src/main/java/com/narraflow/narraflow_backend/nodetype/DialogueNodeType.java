package com.narraflow.narraflow_backend.nodetype;

import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.payload.DialoguePayload;
import com.narraflow.narraflow_backend.model.payload.DialogueResponse;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
class DialogueNodeType extends TypedNodeTypeHandler<DialoguePayload> {

    DialogueNodeType() {
        super(NodeType.DIALOGUE, DialoguePayload.class);
    }

    @Override
    public DialoguePayload defaultPayload() {
        return new DialoguePayload(null, "", null, null, null, List.of());
    }

    @Override
    protected DialoguePayload normalizeTyped(DialoguePayload payload) {
        required(payload.text(), "text");
        List<DialogueResponse> responses = required(payload.responses(), "responses");

        // Response ids are output pin names, so they must be usable as such
        Set<String> seen = new HashSet<>();
        for (DialogueResponse response : responses) {
            required(response, "response");
            if (response.id() == null || response.id().isBlank()) {
                throw violation("response id must not be blank");
            }
            if (!seen.add(response.id())) {
                throw violation("duplicate response id '" + response.id() + "'");
            }
        }
        return new DialoguePayload(blankToNull(payload.speakerSheetId()), payload.text(),
                payload.stageDirections(), payload.menuText(), blankToNull(payload.technicalId()),
                List.copyOf(responses));
    }
}
