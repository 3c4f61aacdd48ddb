package com.narraflow.narraflow_backend.controller;

import com.narraflow.narraflow_backend.controller.advice.GlobalExceptionHandler;
import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.domain.ReferenceKind;
import com.narraflow.narraflow_backend.model.dto.RepairReport;
import com.narraflow.narraflow_backend.model.dto.UsageCount;
import com.narraflow.narraflow_backend.model.dto.VariableUsage;
import com.narraflow.narraflow_backend.model.dto.VariableUsageEntry;
import com.narraflow.narraflow_backend.service.VariableReferenceRepairService;
import com.narraflow.narraflow_backend.service.VariableReferenceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class VariableUsageControllerTest {

    @Mock
    private VariableReferenceTracker referenceTracker;

    @Mock
    private VariableReferenceRepairService repairService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new VariableUsageController(referenceTracker, repairService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void usageListsReadsWithEditorLinks() throws Exception {
        UUID flowId = UUID.randomUUID();
        UUID nodeId = UUID.randomUUID();
        VariableUsageEntry entry = new VariableUsageEntry(flowId, "Battle", "battle", nodeId, NodeType.CONDITION,
                ReferenceKind.READ, "mc.jaime.health > 50", "/flows/" + flowId + "?node=" + nodeId,
                "mc.jaime", "health", false);
        when(referenceTracker.usage("var-1")).thenReturn(new VariableUsage("var-1", List.of(entry), List.of()));

        mockMvc.perform(get("/api/variables/var-1/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reads[0].summary").value("mc.jaime.health > 50"))
                .andExpect(jsonPath("$.reads[0].link").value("/flows/" + flowId + "?node=" + nodeId))
                .andExpect(jsonPath("$.writes").isEmpty());
    }

    @Test
    void countReturnsBothKinds() throws Exception {
        when(referenceTracker.count("var-1")).thenReturn(new UsageCount(3, 1));

        mockMvc.perform(get("/api/variables/var-1/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.read").value(3))
                .andExpect(jsonPath("$.write").value(1));
    }

    @Test
    void staleCheckNeedsAProject() throws Exception {
        mockMvc.perform(get("/api/variables/var-1/stale"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(referenceTracker);
    }

    @Test
    void repairReportsSkippedNodes() throws Exception {
        UUID projectId = UUID.randomUUID();
        UUID skipped = UUID.randomUUID();
        when(repairService.repair(projectId, "var-1")).thenReturn(new RepairReport("var-1", List.of(), List.of(skipped)));

        mockMvc.perform(post("/api/variables/var-1/repair").param("projectId", projectId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skippedNodeIds[0]").value(skipped.toString()));
    }

    @Test
    void deletingReferencesReportsHowManyWereRemoved() throws Exception {
        when(referenceTracker.deleteReferencesForVariable("var-1")).thenReturn(4);

        mockMvc.perform(delete("/api/variables/var-1/references"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(4));
    }
}
