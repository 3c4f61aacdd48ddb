package com.narraflow.narraflow_backend.service;

import com.narraflow.narraflow_backend.catalog.VariableCatalog;
import com.narraflow.narraflow_backend.catalog.VariableDescriptor;
import com.narraflow.narraflow_backend.exception.FlowNotFoundException;
import com.narraflow.narraflow_backend.exception.PayloadSchemaViolationException;
import com.narraflow.narraflow_backend.model.domain.Flow;
import com.narraflow.narraflow_backend.model.domain.FlowNode;
import com.narraflow.narraflow_backend.model.domain.ReferenceKind;
import com.narraflow.narraflow_backend.model.domain.VariableReference;
import com.narraflow.narraflow_backend.model.dto.UsageCount;
import com.narraflow.narraflow_backend.model.dto.VariableUsage;
import com.narraflow.narraflow_backend.model.dto.VariableUsageEntry;
import com.narraflow.narraflow_backend.model.payload.NodePayload;
import com.narraflow.narraflow_backend.model.payload.VariableUse;
import com.narraflow.narraflow_backend.nodetype.NodeTypeRegistry;
import com.narraflow.narraflow_backend.repository.FlowNodeRepository;
import com.narraflow.narraflow_backend.repository.FlowRepository;
import com.narraflow.narraflow_backend.repository.VariableReferenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maintains the variable reference index: which live nodes read or write which sheet variables.
 * References are always derived from payloads and replaced wholesale, never edited in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VariableReferenceTracker {

    private final VariableReferenceRepository referenceRepository;
    private final FlowRepository flowRepository;
    private final FlowNodeRepository nodeRepository;
    private final VariableCatalog catalog;
    private final VariableReferenceExtractor extractor;
    private final NodeTypeRegistry nodeTypes;

    /**
     * Resolves the payload's variable uses against the catalog. Uses that do not resolve are
     * dropped. With {@code strictKinds} an operator the variable's kind does not allow is a
     * {@link PayloadSchemaViolationException}; otherwise it is logged and the reference kept.
     */
    public List<DerivedReference> derive(Flow flow, NodePayload payload, boolean strictKinds) {
        List<VariableUse> uses = extractor.extract(payload);
        if (uses.isEmpty()) {
            return List.of();
        }
        Map<String, DerivedReference> byKey = new LinkedHashMap<>();
        for (VariableUse use : uses) {
            Optional<VariableDescriptor> resolved = catalog.resolve(flow.getProjectId(), use.sheet(), use.variable());
            if (resolved.isEmpty()) {
                log.debug("Dropping reference to unknown variable {} in flow {}", use.qualifiedName(), flow.getId());
                continue;
            }
            VariableDescriptor variable = resolved.get();
            if (variable.kind() != null && !use.allowedKinds().contains(variable.kind())) {
                String message = "Operator " + use.operator() + " cannot be used with "
                        + variable.kind().wireName() + " variable " + use.qualifiedName();
                if (strictKinds) {
                    throw new PayloadSchemaViolationException(message);
                }
                log.warn("{} (flow {}); keeping the reference", message, flow.getId());
            }
            byKey.putIfAbsent(variable.id() + "|" + use.kind(),
                    new DerivedReference(variable.id(), use.kind(), use.sheet(), use.variable()));
        }
        return List.copyOf(byKey.values());
    }

    /** Deletes the node's reference rows and inserts {@code references} in their place. */
    @Transactional
    public void replaceReferences(FlowNode node, List<DerivedReference> references) {
        referenceRepository.deleteByNodeId(node.getId());
        if (references.isEmpty()) {
            return;
        }
        List<VariableReference> rows = references.stream().map(ref -> {
            VariableReference row = new VariableReference();
            row.setFlowId(node.getFlowId());
            row.setFlowNodeId(node.getId());
            row.setVariableId(ref.variableId());
            row.setKind(ref.kind());
            row.setSourceSheet(ref.sourceSheet());
            row.setSourceVariable(ref.sourceVariable());
            return row;
        }).toList();
        referenceRepository.saveAll(rows);
        log.debug("Indexed {} variable references for node {}", rows.size(), node.getId());
    }

    /** Re-derives a node's references from its stored payload (restore paths). */
    @Transactional
    public void refresh(Flow flow, FlowNode node) {
        replaceReferences(node, derive(flow, nodeTypes.read(node), false));
    }

    @Transactional
    public void deleteReferencesForNode(UUID nodeId) {
        referenceRepository.deleteByNodeId(nodeId);
    }

    @Transactional
    public void deleteReferencesForFlows(Collection<UUID> flowIds) {
        if (!flowIds.isEmpty()) {
            int removed = referenceRepository.deleteByFlowIds(flowIds);
            log.debug("Removed {} variable references for flows {}", removed, flowIds);
        }
    }

    /** Cascade for a variable deleted in the sheet service. */
    @Transactional
    public int deleteReferencesForVariable(String variableId) {
        int removed = referenceRepository.deleteByVariableId(variableId);
        log.info("Removed {} references to deleted variable {}", removed, variableId);
        return removed;
    }

    @Transactional(readOnly = true)
    public List<VariableReference> referencesTo(String variableId) {
        return referenceRepository.findByVariableId(variableId);
    }

    @Transactional(readOnly = true)
    public List<VariableReference> referencesOf(UUID nodeId) {
        return referenceRepository.findByFlowNodeId(nodeId);
    }

    @Transactional(readOnly = true)
    public VariableUsage usage(String variableId) {
        List<VariableUsageEntry> entries = usageRows(variableId, null).stream()
                .map(UsageRow::entry)
                .toList();
        return split(variableId, entries);
    }

    @Transactional(readOnly = true)
    public UsageCount count(String variableId) {
        long read = 0;
        long write = 0;
        for (Object[] row : referenceRepository.countByKind(variableId)) {
            if (row[0] == ReferenceKind.READ) read = ((Number) row[1]).longValue();
            else if (row[0] == ReferenceKind.WRITE) write = ((Number) row[1]).longValue();
        }
        return new UsageCount(read, write);
    }

    /**
     * Usages of a variable with {@code stale} set where the node's live payload no longer names
     * the variable by its current sheet shortcut and name (the variable was renamed). A variable
     * that no longer exists makes every usage stale.
     */
    @Transactional(readOnly = true)
    public VariableUsage checkStale(UUID projectId, String variableId) {
        Optional<VariableDescriptor> current = catalog.findById(projectId, variableId);
        List<VariableUsageEntry> entries = new ArrayList<>();
        for (UsageRow row : usageRows(variableId, projectId)) {
            boolean stale = current.map(variable -> !namedInPayload(row, variable)).orElse(true);
            entries.add(row.entry().markStale(stale));
        }
        return split(variableId, entries);
    }

    /** Ids of nodes in the flow holding at least one reference whose text no longer matches the catalog. */
    @Transactional(readOnly = true)
    public Set<UUID> listStaleNodeIds(UUID flowId) {
        Flow flow = flowRepository.findByIdAndDeletedAtIsNull(flowId)
                .orElseThrow(() -> new FlowNotFoundException(flowId));
        Map<String, List<VariableReference>> byVariable = referenceRepository.findByFlowId(flowId).stream()
                .collect(Collectors.groupingBy(VariableReference::getVariableId));

        Set<UUID> stale = new LinkedHashSet<>();
        byVariable.forEach((variableId, refs) -> {
            Optional<VariableDescriptor> current = catalog.findById(flow.getProjectId(), variableId);
            for (VariableReference ref : refs) {
                boolean matches = current.map(v -> v.isNamed(ref.getSourceSheet(), ref.getSourceVariable()))
                        .orElse(false);
                if (!matches) stale.add(ref.getFlowNodeId());
            }
        });
        return stale;
    }

    private boolean namedInPayload(UsageRow row, VariableDescriptor variable) {
        NodePayload payload;
        try {
            payload = nodeTypes.read(row.node());
        } catch (PayloadSchemaViolationException e) {
            log.warn("Stored payload of node {} no longer parses: {}", row.node().getId(), e.getMessage());
            return false;
        }
        return extractor.extract(payload).stream()
                .anyMatch(use -> use.kind() == row.reference().getKind()
                        && use.matches(variable.sheetShortcut(), variable.variableName()));
    }

    // References whose node and flow are both live; optionally restricted to one project
    private List<UsageRow> usageRows(String variableId, UUID projectId) {
        List<VariableReference> refs = referenceRepository.findByVariableId(variableId);
        if (refs.isEmpty()) {
            return List.of();
        }
        Map<UUID, FlowNode> nodes = nodeRepository.findAllById(
                        refs.stream().map(VariableReference::getFlowNodeId).collect(Collectors.toSet()))
                .stream().collect(Collectors.toMap(FlowNode::getId, Function.identity()));
        Map<UUID, Flow> flows = flowRepository.findAllById(
                        refs.stream().map(VariableReference::getFlowId).collect(Collectors.toSet()))
                .stream().collect(Collectors.toMap(Flow::getId, Function.identity()));

        List<UsageRow> rows = new ArrayList<>();
        for (VariableReference ref : refs) {
            FlowNode node = nodes.get(ref.getFlowNodeId());
            Flow flow = flows.get(ref.getFlowId());
            if (node == null || flow == null || node.isDeleted() || flow.isDeleted()) continue;
            if (projectId != null && !projectId.equals(flow.getProjectId())) continue;
            rows.add(new UsageRow(ref, flow, node, toEntry(ref, flow, node)));
        }
        rows.sort(Comparator.comparing((UsageRow row) -> row.flow().getName(), String.CASE_INSENSITIVE_ORDER)
                .thenComparing(row -> row.node().getCreatedAt()));
        return rows;
    }

    private VariableUsageEntry toEntry(VariableReference ref, Flow flow, FlowNode node) {
        return new VariableUsageEntry(
                flow.getId(), flow.getName(), flow.getShortcut(),
                node.getId(), node.getNodeType(), ref.getKind(),
                summaryOf(node),
                "/flows/" + flow.getId() + "?node=" + node.getId(),
                ref.getSourceSheet(), ref.getSourceVariable(),
                false);
    }

    private String summaryOf(FlowNode node) {
        try {
            return nodeTypes.read(node).summary();
        } catch (PayloadSchemaViolationException e) {
            log.warn("Stored payload of node {} no longer parses: {}", node.getId(), e.getMessage());
            return "";
        }
    }

    private static VariableUsage split(String variableId, List<VariableUsageEntry> entries) {
        Map<ReferenceKind, List<VariableUsageEntry>> byKind = entries.stream()
                .collect(Collectors.groupingBy(VariableUsageEntry::kind, () -> new EnumMap<>(ReferenceKind.class),
                        Collectors.toList()));
        return new VariableUsage(variableId,
                byKind.getOrDefault(ReferenceKind.READ, List.of()),
                byKind.getOrDefault(ReferenceKind.WRITE, List.of()));
    }

    private record UsageRow(VariableReference reference, Flow flow, FlowNode node, VariableUsageEntry entry) {
    }
}
