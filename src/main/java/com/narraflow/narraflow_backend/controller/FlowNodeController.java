package com.narraflow.narraflow_backend.controller;

import com.narraflow.narraflow_backend.collab.CollaborationService;
import com.narraflow.narraflow_backend.model.collab.LeaseView;
import com.narraflow.narraflow_backend.model.domain.FlowConnection;
import com.narraflow.narraflow_backend.model.domain.FlowNode;
import com.narraflow.narraflow_backend.model.dto.*;
import com.narraflow.narraflow_backend.service.FlowGraphService;
import com.narraflow.narraflow_backend.service.VariableReferenceTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Node and connection edits of one flow. Writes name the editing realtime session in the
 * {@code X-Session-Id} header; payload edits require it.
 */
@RestController
@RequestMapping("/api/flows/{flowId}")
@RequiredArgsConstructor
public class FlowNodeController {

    public static final String SESSION_HEADER = "X-Session-Id";

    private final CollaborationService collaborationService;
    private final FlowGraphService flowGraphService;
    private final VariableReferenceTracker referenceTracker;

    @PostMapping("/nodes")
    public ResponseEntity<FlowNode> createNode(@PathVariable UUID flowId,
                                               @RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                                               @RequestBody CreateNodeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(collaborationService.createNode(flowId, sessionId, request));
    }

    @PutMapping("/nodes/{nodeId}/payload")
    public FlowNode updatePayload(@PathVariable UUID flowId, @PathVariable UUID nodeId,
                                  @RequestHeader(SESSION_HEADER) String sessionId,
                                  @RequestBody Map<String, Object> payload) {
        return collaborationService.updateNodePayload(flowId, nodeId, sessionId, payload);
    }

    @PutMapping("/nodes/{nodeId}/position")
    public FlowNode updatePosition(@PathVariable UUID flowId, @PathVariable UUID nodeId,
                                   @RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                                   @RequestBody NodePositionRequest position) {
        return collaborationService.updateNodePosition(flowId, nodeId, sessionId, position);
    }

    @DeleteMapping("/nodes/{nodeId}")
    public NodeDeletion deleteNode(@PathVariable UUID flowId, @PathVariable UUID nodeId,
                                   @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        return collaborationService.deleteNode(flowId, nodeId, sessionId);
    }

    @PostMapping("/nodes/{nodeId}/restore")
    public FlowNode restoreNode(@PathVariable UUID flowId, @PathVariable UUID nodeId,
                                @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        return collaborationService.restoreNode(flowId, nodeId, sessionId);
    }

    @GetMapping("/hubs")
    public List<HubSummary> listHubs(@PathVariable UUID flowId) {
        return flowGraphService.listHubs(flowId);
    }

    @PostMapping("/connections")
    public ResponseEntity<FlowConnection> createConnection(@PathVariable UUID flowId,
                                                           @RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                                                           @RequestBody CreateConnectionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(collaborationService.createConnection(flowId, sessionId, request));
    }

    // Deleting a connection that is already gone is not an error
    @DeleteMapping("/connections/{connectionId}")
    public ResponseEntity<Void> deleteConnection(@PathVariable UUID flowId, @PathVariable UUID connectionId,
                                                 @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        collaborationService.deleteConnection(flowId, connectionId, sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/locks")
    public List<LeaseView> listLocks(@PathVariable UUID flowId) {
        return collaborationService.listLocks(flowId);
    }

    @GetMapping("/stale-nodes")
    public Set<UUID> listStaleNodes(@PathVariable UUID flowId) {
        return referenceTracker.listStaleNodeIds(flowId);
    }
}
