package com.narraflow.narraflow_backend.controller;

import com.narraflow.narraflow_backend.collab.CollaborationService;
import com.narraflow.narraflow_backend.model.domain.Flow;
import com.narraflow.narraflow_backend.model.dto.*;
import com.narraflow.narraflow_backend.service.FlowGraphService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FlowController {

    private final FlowGraphService flowGraphService;
    private final CollaborationService collaborationService;

    @PostMapping("/projects/{projectId}/flows")
    public ResponseEntity<Flow> createFlow(@PathVariable UUID projectId, @RequestBody CreateFlowRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(flowGraphService.createFlow(projectId, request));
    }

    @GetMapping("/projects/{projectId}/flows")
    public List<FlowTreeNode> listFlows(@PathVariable UUID projectId) {
        return flowGraphService.listFlowTree(projectId);
    }

    @GetMapping("/projects/{projectId}/flows/trash")
    public List<Flow> listTrash(@PathVariable UUID projectId) {
        return flowGraphService.listTrash(projectId);
    }

    @GetMapping("/flows/{flowId}")
    public FlowGraphDto getFlow(@PathVariable UUID flowId) {
        return flowGraphService.getGraph(flowId);
    }

    @PutMapping("/flows/{flowId}")
    public ResponseEntity<Flow> renameFlow(@PathVariable UUID flowId, @RequestBody Map<String, String> body) {
        if (body == null || !body.containsKey("name")) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(collaborationService.renameFlow(flowId, body.get("name")));
    }

    @PutMapping("/flows/{flowId}/viewport")
    public Flow updateViewport(@PathVariable UUID flowId, @RequestBody ViewportDto viewport) {
        return flowGraphService.updateViewport(flowId, viewport);
    }

    @PostMapping("/flows/{flowId}/move")
    public Flow moveFlow(@PathVariable UUID flowId, @RequestBody MoveFlowRequest request) {
        return collaborationService.moveFlow(flowId, request);
    }

    /** Moves the flow and its descendants to the trash. */
    @DeleteMapping("/flows/{flowId}")
    public Flow deleteFlow(@PathVariable UUID flowId) {
        return collaborationService.deleteFlow(flowId);
    }

    @PostMapping("/flows/{flowId}/restore")
    public Flow restoreFlow(@PathVariable UUID flowId) {
        return collaborationService.restoreFlow(flowId);
    }

    @DeleteMapping("/flows/{flowId}/permanent")
    public ResponseEntity<Void> hardDeleteFlow(@PathVariable UUID flowId) {
        collaborationService.hardDeleteFlow(flowId);
        return ResponseEntity.noContent().build();
    }
}
