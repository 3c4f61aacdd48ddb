package com.narraflow.narraflow_backend.service;

import com.narraflow.narraflow_backend.catalog.VariableCatalog;
import com.narraflow.narraflow_backend.catalog.VariableDescriptor;
import com.narraflow.narraflow_backend.collab.CollaborationService;
import com.narraflow.narraflow_backend.exception.LockConflictException;
import com.narraflow.narraflow_backend.model.domain.Flow;
import com.narraflow.narraflow_backend.model.domain.FlowNode;
import com.narraflow.narraflow_backend.model.domain.VariableReference;
import com.narraflow.narraflow_backend.model.dto.RepairReport;
import com.narraflow.narraflow_backend.model.payload.NodePayload;
import com.narraflow.narraflow_backend.nodetype.NodeTypeRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Rewrites payloads that still name a variable by an old sheet shortcut or name, after the
 * variable was renamed in the sheet service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VariableReferenceRepairService {

    private final VariableCatalog catalog;
    private final VariableReferenceTracker tracker;
    private final FlowGraphService flowGraphService;
    private final NodeTypeRegistry nodeTypes;
    private final CollaborationService collaborationService;

    /**
     * Repairs every stale reference of the variable in the project. Nodes another session is
     * editing are skipped and reported. Does nothing for a variable the catalog no longer knows.
     */
    public RepairReport repair(UUID projectId, String variableId) {
        Optional<VariableDescriptor> current = catalog.findById(projectId, variableId);
        if (current.isEmpty()) {
            log.info("Variable {} no longer exists in project {}; nothing to repair", variableId, projectId);
            return new RepairReport(variableId, List.of(), List.of());
        }
        VariableDescriptor variable = current.get();

        Map<UUID, List<VariableReference>> staleByNode = tracker.referencesTo(variableId).stream()
                .filter(ref -> !variable.isNamed(ref.getSourceSheet(), ref.getSourceVariable()))
                .collect(Collectors.groupingBy(VariableReference::getFlowNodeId, LinkedHashMap::new, Collectors.toList()));

        List<UUID> repaired = new ArrayList<>();
        List<UUID> skipped = new ArrayList<>();
        staleByNode.forEach((nodeId, refs) -> {
            FlowNode node = flowGraphService.getNode(nodeId);
            Flow flow = flowGraphService.getFlow(node.getFlowId());
            if (!projectId.equals(flow.getProjectId())) {
                return;
            }
            NodePayload payload = nodeTypes.read(node);
            NodePayload renamed = payload;
            for (VariableReference ref : refs) {
                renamed = renamed.renameVariable(ref.getSourceSheet(), ref.getSourceVariable(),
                        variable.sheetShortcut(), variable.variableName());
            }
            if (renamed.equals(payload)) {
                return;
            }
            try {
                collaborationService.applySystemPayload(flow.getId(), nodeId, nodeTypes.toMap(renamed));
                repaired.add(nodeId);
            } catch (LockConflictException e) {
                log.info("Skipping repair of node {}: being edited by {}", nodeId,
                        e.getHeldLease().holder().displayName());
                skipped.add(nodeId);
            }
        });
        log.info("Repaired {} node(s) referencing variable {} ({} skipped)", repaired.size(), variableId, skipped.size());
        return new RepairReport(variableId, repaired, skipped);
    }
}
