package com.narraflow.narraflow_backend.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narraflow.narraflow_backend.model.domain.NodeType;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DialoguePayload(@JsonProperty("speaker_sheet_id") String speakerSheetId,
                              @JsonProperty(value = "text", required = true) String text,
                              @JsonProperty("stage_directions") String stageDirections,
                              @JsonProperty("menu_text") String menuText,
                              @JsonProperty("technical_id") String technicalId,
                              @JsonProperty(value = "responses", required = true) List<DialogueResponse> responses)
        implements NodePayload {

    private static final int SUMMARY_LENGTH = 80;

    @Override
    public NodeType type() {
        return NodeType.DIALOGUE;
    }

    @Override
    public String summary() {
        // text is rich text from the editor
        String plain = text == null ? "" : text.replaceAll("<[^>]*>", " ").replaceAll("\\s+", " ").trim();
        if (plain.isEmpty() && NodePayload.hasText(menuText)) {
            plain = menuText.trim();
        }
        return plain.length() > SUMMARY_LENGTH ? plain.substring(0, SUMMARY_LENGTH - 1) + "…" : plain;
    }
}
