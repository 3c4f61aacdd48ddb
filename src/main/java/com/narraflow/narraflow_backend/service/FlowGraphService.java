package com.narraflow.narraflow_backend.service;

import com.narraflow.narraflow_backend.exception.FlowNotFoundException;
import com.narraflow.narraflow_backend.exception.NodeNotFoundException;
import com.narraflow.narraflow_backend.exception.PayloadSchemaViolationException;
import com.narraflow.narraflow_backend.exception.StructuralViolationException;
import com.narraflow.narraflow_backend.model.domain.Flow;
import com.narraflow.narraflow_backend.model.domain.FlowConnection;
import com.narraflow.narraflow_backend.model.domain.FlowNode;
import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.dto.*;
import com.narraflow.narraflow_backend.model.payload.ExitMode;
import com.narraflow.narraflow_backend.model.payload.ExitPayload;
import com.narraflow.narraflow_backend.model.payload.HubPayload;
import com.narraflow.narraflow_backend.model.payload.JumpPayload;
import com.narraflow.narraflow_backend.model.payload.NodePayload;
import com.narraflow.narraflow_backend.model.payload.SubflowPayload;
import com.narraflow.narraflow_backend.nodetype.NodeTypeRegistry;
import com.narraflow.narraflow_backend.repository.FlowConnectionRepository;
import com.narraflow.narraflow_backend.repository.FlowNodeRepository;
import com.narraflow.narraflow_backend.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owns flows, nodes and connections. Every write validates first and mutates afterwards, and
 * payload writes re-index variable references in the same transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowGraphService {

    static final double ENTRY_X = 100.0;
    static final double ENTRY_Y = 300.0;

    private static final String DEFAULT_FLOW_NAME = "Untitled flow";
    private static final Pattern GENERATED_HUB_ID = Pattern.compile("^hub_(\\d+)$");
    private static final Set<NodeType> FLOW_REFERENCING_TYPES = EnumSet.of(NodeType.SUBFLOW, NodeType.EXIT);
    // Upper bound when walking the flow tree upwards
    private static final int MAX_TREE_DEPTH = 1000;

    private final FlowRepository flowRepository;
    private final FlowNodeRepository nodeRepository;
    private final FlowConnectionRepository connectionRepository;
    private final NodeTypeRegistry nodeTypes;
    private final VariableReferenceTracker referenceTracker;

    // Flows

    /** Creates a flow with its entry node. Re-applying a request with the same {@code id} returns the existing flow. */
    @Transactional
    public Flow createFlow(UUID projectId, CreateFlowRequest request) {
        if (request.id() != null) {
            Optional<Flow> existing = flowRepository.findById(request.id());
            if (existing.isPresent()) {
                if (!existing.get().getProjectId().equals(projectId)) {
                    throw new StructuralViolationException("Flow id " + request.id() + " is already in use", request.id());
                }
                return existing.get();
            }
        }
        if (request.parentId() != null) {
            requireFlowInProject(request.parentId(), projectId);
        }

        String name = hasText(request.name()) ? request.name().trim() : DEFAULT_FLOW_NAME;
        String base = hasText(request.shortcut()) ? toShortcut(request.shortcut()) : toShortcut(name);
        List<Flow> siblings = siblingsOf(projectId, request.parentId());

        Flow flow = new Flow();
        flow.setId(request.id() != null ? request.id() : UUID.randomUUID());
        flow.setProjectId(projectId);
        flow.setName(name);
        flow.setParentId(request.parentId());
        flow.setShortcut(uniqueShortcut(projectId, base, null));
        flow.setMain(Boolean.TRUE.equals(request.main()));
        flow.setViewport(defaultViewport());
        flow.setPosition(siblings.size());
        flow = flowRepository.save(flow);
        if (request.position() != null) {
            placeAmongSiblings(flow, siblings, request.position());
        }

        FlowNode entry = newNode(UUID.randomUUID(), flow.getId(), NodeType.ENTRY, ENTRY_X, ENTRY_Y);
        entry.setPayload(nodeTypes.toMap(nodeTypes.defaultPayload(NodeType.ENTRY)));
        nodeRepository.save(entry);

        log.info("Created flow {} '{}' ({}) in project {}", flow.getId(), flow.getName(), flow.getShortcut(), projectId);
        return flow;
    }

    @Transactional(readOnly = true)
    public Flow getFlow(UUID flowId) {
        return requireLiveFlow(flowId);
    }

    @Transactional(readOnly = true)
    public FlowGraphDto getGraph(UUID flowId) {
        Flow flow = requireLiveFlow(flowId);
        return new FlowGraphDto(
                flow,
                nodeRepository.findByFlowIdAndDeletedAtIsNullOrderByCreatedAtAsc(flowId),
                connectionRepository.findByFlowIdOrderByCreatedAtAsc(flowId));
    }

    /** Live flows of a project as a tree, siblings ordered by position then name. */
    @Transactional(readOnly = true)
    public List<FlowTreeNode> listFlowTree(UUID projectId) {
        List<Flow> flows = flowRepository.findByProjectIdAndDeletedAtIsNullOrderByPositionAscNameAsc(projectId);
        Set<UUID> liveIds = new HashSet<>();
        flows.forEach(flow -> liveIds.add(flow.getId()));

        // null key collects the roots
        Map<UUID, List<Flow>> childrenByParent = new HashMap<>();
        for (Flow flow : flows) {
            UUID parent = flow.getParentId() != null && liveIds.contains(flow.getParentId()) ? flow.getParentId() : null;
            childrenByParent.computeIfAbsent(parent, key -> new ArrayList<>()).add(flow);
        }
        return buildTree(null, childrenByParent);
    }

    @Transactional
    public Flow renameFlow(UUID flowId, String name) {
        if (!hasText(name)) {
            throw new IllegalArgumentException("Flow name must not be blank");
        }
        Flow flow = requireLiveFlow(flowId);
        flow.setName(name.trim());
        flow.setShortcut(uniqueShortcut(flow.getProjectId(), toShortcut(name), flow.getId()));
        return flowRepository.save(flow);
    }

    @Transactional
    public Flow updateViewport(UUID flowId, ViewportDto viewport) {
        Flow flow = requireLiveFlow(flowId);
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("x", viewport.x() != null ? viewport.x() : 0.0);
        value.put("y", viewport.y() != null ? viewport.y() : 0.0);
        value.put("zoom", viewport.zoom() != null ? viewport.zoom() : 1.0);
        flow.setViewport(value);
        return flowRepository.save(flow);
    }

    /**
     * Re-parents a flow within the organisational tree. Siblings under the old and the new
     * parent are renumbered densely from 0.
     */
    @Transactional
    public Flow moveFlow(UUID flowId, MoveFlowRequest request) {
        Flow flow = requireLiveFlow(flowId);
        UUID newParentId = request.parentId();
        if (newParentId != null) {
            if (newParentId.equals(flowId)) {
                throw new StructuralViolationException("A flow cannot be moved under itself", flowId);
            }
            Flow parent = requireFlowInProject(newParentId, flow.getProjectId());
            if (isAncestor(flowId, parent)) {
                throw new StructuralViolationException("A flow cannot be moved under one of its descendants", flowId);
            }
        }

        UUID oldParentId = flow.getParentId();
        flow.setParentId(newParentId);
        List<Flow> siblings = siblingsOf(flow.getProjectId(), newParentId);
        siblings.removeIf(sibling -> sibling.getId().equals(flowId));
        int position = request.position() != null ? request.position() : siblings.size();
        placeAmongSiblings(flow, siblings, position);

        if (!Objects.equals(oldParentId, newParentId)) {
            renumber(siblingsOf(flow.getProjectId(), oldParentId));
        }
        log.info("Moved flow {} under {} at position {}", flowId, newParentId, flow.getPosition());
        return flow;
    }

    /**
     * Moves a flow and all of its live descendants to the trash and drops their variable
     * references. Deleting a flow that is already in the trash changes nothing.
     */
    @Transactional
    public Flow deleteFlow(UUID flowId) {
        Flow flow = flowRepository.findById(flowId).orElseThrow(() -> new FlowNotFoundException(flowId));
        if (flow.isDeleted()) {
            return flow;
        }
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        List<Flow> subtree = collectSubtree(flow, candidate -> !candidate.isDeleted());
        subtree.forEach(member -> member.setDeletedAt(now));
        flowRepository.saveAll(subtree);

        List<UUID> ids = subtree.stream().map(Flow::getId).toList();
        referenceTracker.deleteReferencesForFlows(ids);
        renumber(siblingsOf(flow.getProjectId(), flow.getParentId()));

        log.info("Moved flow {} and {} descendant(s) to trash", flowId, subtree.size() - 1);
        return flow;
    }

    /**
     * Restores a trashed flow together with the descendants trashed with it, then rebuilds
     * their variable references. A flow whose parent is still in the trash is restored at the root.
     */
    @Transactional
    public Flow restoreFlow(UUID flowId) {
        Flow flow = flowRepository.findById(flowId).orElseThrow(() -> new FlowNotFoundException(flowId));
        if (!flow.isDeleted()) {
            return flow;
        }
        Instant deletedAt = flow.getDeletedAt();
        List<Flow> subtree = collectSubtree(flow, candidate -> deletedAt.equals(candidate.getDeletedAt()));

        if (flow.getParentId() != null && flowRepository.findByIdAndDeletedAtIsNull(flow.getParentId()).isEmpty()) {
            flow.setParentId(null);
        }
        flow.setPosition(siblingsOf(flow.getProjectId(), flow.getParentId()).size());
        for (Flow member : subtree) {
            member.setShortcut(uniqueShortcut(member.getProjectId(), member.getShortcut(), member.getId()));
            member.setDeletedAt(null);
        }
        flowRepository.saveAll(subtree);

        Map<UUID, Flow> byId = new HashMap<>();
        subtree.forEach(member -> byId.put(member.getId(), member));
        List<FlowNode> nodes = nodeRepository.findByFlowIdInAndDeletedAtIsNull(byId.keySet());
        for (FlowNode node : nodes) {
            referenceTracker.refresh(byId.get(node.getFlowId()), node);
        }
        log.info("Restored flow {} with {} descendant(s) and {} node(s)", flowId, subtree.size() - 1, nodes.size());
        return flow;
    }

    /** Top-level trashed flows of a project, most recently deleted first. */
    @Transactional(readOnly = true)
    public List<Flow> listTrash(UUID projectId) {
        List<Flow> trashed = flowRepository.findByProjectIdAndDeletedAtIsNotNullOrderByDeletedAtDesc(projectId);
        Set<UUID> trashedIds = new HashSet<>();
        trashed.forEach(flow -> trashedIds.add(flow.getId()));
        return trashed.stream()
                .filter(flow -> flow.getParentId() == null || !trashedIds.contains(flow.getParentId()))
                .toList();
    }

    /** Permanently removes a trashed flow, its trashed descendants and all their nodes, connections and references. */
    @Transactional
    public void hardDeleteFlow(UUID flowId) {
        Flow flow = flowRepository.findById(flowId).orElseThrow(() -> new FlowNotFoundException(flowId));
        if (!flow.isDeleted()) {
            throw new StructuralViolationException("Only flows in the trash can be deleted permanently", flowId);
        }
        List<Flow> subtree = collectSubtree(flow, Flow::isDeleted);
        List<UUID> ids = subtree.stream().map(Flow::getId).toList();

        referenceTracker.deleteReferencesForFlows(ids);
        int connections = connectionRepository.deleteByFlowIds(ids);
        int nodes = nodeRepository.deleteByFlowIds(ids);
        flowRepository.deleteAll(subtree);
        log.info("Permanently deleted flow {} ({} flow(s), {} node(s), {} connection(s))",
                flowId, ids.size(), nodes, connections);
    }

    /** Hard-deletes every flow that has been in the trash since before {@code cutoff}. */
    @Transactional
    public int purgeTrash(Instant cutoff) {
        int purged = 0;
        for (Flow flow : flowRepository.findByDeletedAtBefore(cutoff)) {
            // may already be gone with an ancestor purged earlier in this loop
            if (flowRepository.existsById(flow.getId())) {
                hardDeleteFlow(flow.getId());
                purged++;
            }
        }
        return purged;
    }

    // Nodes

    /**
     * Creates a node. Without a payload the type's default is used; an explicit payload is
     * validated like an update. A retry with the same {@code id} returns the node created first.
     */
    @Transactional
    public FlowNode createNode(UUID flowId, CreateNodeRequest request) {
        Flow flow = lockLiveFlow(flowId);
        NodeType type = request.nodeType();
        if (type == null) {
            throw new PayloadSchemaViolationException("nodeType is required");
        }
        if (request.id() != null) {
            Optional<FlowNode> existing = nodeRepository.findById(request.id());
            if (existing.isPresent()) {
                FlowNode node = existing.get();
                if (node.getFlowId().equals(flowId) && node.getNodeType() == type && !node.isDeleted()) {
                    return node;
                }
                throw new StructuralViolationException("Node id " + request.id() + " is already in use", request.id());
            }
        }

        NodePayload payload = request.payload() == null
                ? nodeTypes.defaultPayload(type)
                : nodeTypes.parse(type, request.payload());
        if (type == NodeType.ENTRY && nodeRepository.countByFlowIdAndNodeTypeAndDeletedAtIsNull(flowId, NodeType.ENTRY) > 0) {
            throw new StructuralViolationException("Flow " + flowId + " already has an entry node", flowId);
        }
        if (payload instanceof HubPayload hub && hub.hubId().isEmpty()) {
            payload = hub.withHubId(nextHubId(flowId));
        }
        checkStructure(flow, null, payload);
        List<DerivedReference> references = referenceTracker.derive(flow, payload, true);

        FlowNode node = newNode(request.id() != null ? request.id() : UUID.randomUUID(), flowId, type,
                request.positionX() != null ? request.positionX() : 0.0,
                request.positionY() != null ? request.positionY() : 0.0);
        node.setPayload(nodeTypes.toMap(payload));
        node = nodeRepository.save(node);
        referenceTracker.replaceReferences(node, references);

        log.info("Created {} node {} in flow {}", type.wireName(), node.getId(), flowId);
        return node;
    }

    @Transactional(readOnly = true)
    public FlowNode getNode(UUID nodeId) {
        return requireLiveNode(nodeId);
    }

    /** Live node that must belong to {@code flowId}; a node of another flow is reported as not found. */
    @Transactional(readOnly = true)
    public FlowNode requireNodeOfFlow(UUID flowId, UUID nodeId) {
        FlowNode node = requireLiveNode(nodeId);
        if (!node.getFlowId().equals(flowId)) {
            throw new NodeNotFoundException(nodeId);
        }
        return node;
    }

    /** Like {@link #requireNodeOfFlow} but also finds soft-deleted nodes. */
    @Transactional(readOnly = true)
    public FlowNode requireAnyNodeOfFlow(UUID flowId, UUID nodeId) {
        FlowNode node = nodeRepository.findById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
        if (!node.getFlowId().equals(flowId)) {
            throw new NodeNotFoundException(nodeId);
        }
        return node;
    }

    @Transactional
    public FlowNode updateNodePosition(UUID nodeId, NodePositionRequest position) {
        FlowNode node = requireLiveNode(nodeId);
        if (position.x() != null) node.setPositionX(position.x());
        if (position.y() != null) node.setPositionY(position.y());
        return nodeRepository.save(node);
    }

    /**
     * Replaces a node's payload. Order: schema validation, structural checks, reference
     * derivation (catalog lookups and operator/kind checks), then the writes. Nothing is written
     * when any step fails. Renaming a hub retargets the jumps that pointed at the old id.
     */
    @Transactional
    public PayloadUpdate updateNodePayload(UUID nodeId, Map<String, Object> rawPayload) {
        FlowNode node = requireLiveNode(nodeId);
        Flow flow = lockLiveFlow(node.getFlowId());

        NodePayload payload = nodeTypes.parse(node.getNodeType(), rawPayload);
        checkStructure(flow, node.getId(), payload);
        List<DerivedReference> references = referenceTracker.derive(flow, payload, true);

        String previousHubId = node.getNodeType() == NodeType.HUB ? hubIdOf(node) : null;
        node.setPayload(nodeTypes.toMap(payload));
        node = nodeRepository.save(node);
        referenceTracker.replaceReferences(node, references);

        List<FlowNode> retargeted = List.of();
        if (payload instanceof HubPayload hub && hasText(previousHubId) && !previousHubId.equals(hub.hubId())) {
            retargeted = retargetJumps(flow.getId(), previousHubId, hub.hubId());
            log.info("Hub {} renamed '{}' -> '{}', retargeted {} jump(s)",
                    nodeId, previousHubId, hub.hubId(), retargeted.size());
        }
        return new PayloadUpdate(node, retargeted);
    }

    /**
     * Soft-deletes a node, hard-deletes its connections and references, and clears the target
     * of jumps pointing at a deleted hub. The entry node cannot be deleted.
     */
    @Transactional
    public NodeDeletion deleteNode(UUID nodeId) {
        FlowNode node = nodeRepository.findById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
        if (node.isDeleted()) {
            return new NodeDeletion(node, List.of(), List.of(), true);
        }
        if (node.getNodeType() == NodeType.ENTRY) {
            throw new StructuralViolationException("The entry node of a flow cannot be deleted", nodeId);
        }
        flowRepository.findByIdForUpdate(node.getFlowId());

        List<FlowConnection> touching = connectionRepository.findTouching(nodeId);
        connectionRepository.deleteAll(touching);
        referenceTracker.deleteReferencesForNode(nodeId);

        List<FlowNode> clearedJumps = List.of();
        if (node.getNodeType() == NodeType.HUB && hasText(hubIdOf(node))) {
            clearedJumps = retargetJumps(node.getFlowId(), hubIdOf(node), "");
        }
        node.setDeletedAt(Instant.now());
        node = nodeRepository.save(node);

        log.info("Deleted node {} from flow {} ({} connection(s) removed)", nodeId, node.getFlowId(), touching.size());
        return new NodeDeletion(node, touching, clearedJumps, false);
    }

    /** Brings back a soft-deleted node and re-indexes its references. Its connections are not restored. */
    @Transactional
    public FlowNode restoreNode(UUID nodeId) {
        FlowNode node = nodeRepository.findById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
        if (!node.isDeleted()) {
            return node;
        }
        Flow flow = lockLiveFlow(node.getFlowId());
        NodePayload payload = nodeTypes.read(node);
        if (payload instanceof HubPayload hub && findHub(flow.getId(), hub.hubId(), nodeId).isPresent()) {
            throw new StructuralViolationException(
                    "Cannot restore hub: id '" + hub.hubId() + "' is now used by another hub", nodeId);
        }
        if (payload instanceof JumpPayload jump && jump.hasTarget()
                && findHub(flow.getId(), jump.targetHubId(), null).isEmpty()) {
            log.info("Restoring jump {} without its target: hub '{}' no longer exists", nodeId, jump.targetHubId());
            payload = jump.withTarget("");
            node.setPayload(nodeTypes.toMap(payload));
        }
        checkStructure(flow, nodeId, payload);
        node.setDeletedAt(null);
        node = nodeRepository.save(node);
        referenceTracker.refresh(flow, node);
        log.info("Restored node {} in flow {}", nodeId, flow.getId());
        return node;
    }

    /** Hubs of a flow, for jump target pickers. */
    @Transactional(readOnly = true)
    public List<HubSummary> listHubs(UUID flowId) {
        requireLiveFlow(flowId);
        return nodeRepository.findByFlowIdAndNodeTypeAndDeletedAtIsNull(flowId, NodeType.HUB).stream()
                .map(node -> {
                    HubPayload hub = (HubPayload) nodeTypes.read(node);
                    return new HubSummary(node.getId(), hub.hubId(), hub.label(), hub.color());
                })
                .sorted(Comparator.comparing(HubSummary::hubId))
                .toList();
    }

    // Connections

    /**
     * Connects two live nodes of the flow. An identical connection (same endpoints and pins) is
     * never duplicated: the existing one is returned.
     */
    @Transactional
    public FlowConnection createConnection(UUID flowId, CreateConnectionRequest request) {
        lockLiveFlow(flowId);
        if (request.sourceNodeId() == null || request.targetNodeId() == null) {
            throw new StructuralViolationException("A connection needs both a source and a target node", flowId);
        }
        if (request.id() != null) {
            Optional<FlowConnection> existing = connectionRepository.findById(request.id());
            if (existing.isPresent()) {
                if (existing.get().getFlowId().equals(flowId)) {
                    return existing.get();
                }
                throw new StructuralViolationException("Connection id " + request.id() + " is already in use", request.id());
            }
        }
        requireNodeInFlow(flowId, request.sourceNodeId(), "Source");
        requireNodeInFlow(flowId, request.targetNodeId(), "Target");
        String sourcePin = hasText(request.sourcePin()) ? request.sourcePin().trim() : FlowConnection.DEFAULT_SOURCE_PIN;
        String targetPin = hasText(request.targetPin()) ? request.targetPin().trim() : FlowConnection.DEFAULT_TARGET_PIN;

        Optional<FlowConnection> duplicate = connectionRepository
                .findFirstByFlowIdAndSourceNodeIdAndSourcePinAndTargetNodeIdAndTargetPin(
                        flowId, request.sourceNodeId(), sourcePin, request.targetNodeId(), targetPin);
        if (duplicate.isPresent()) {
            return duplicate.get();
        }

        FlowConnection connection = new FlowConnection();
        connection.setId(request.id() != null ? request.id() : UUID.randomUUID());
        connection.setFlowId(flowId);
        connection.setSourceNodeId(request.sourceNodeId());
        connection.setSourcePin(sourcePin);
        connection.setTargetNodeId(request.targetNodeId());
        connection.setTargetPin(targetPin);
        connection.setLabel(request.label());
        return connectionRepository.save(connection);
    }

    /** Returns the removed connection, or empty when it did not exist (already deleted). */
    @Transactional
    public Optional<FlowConnection> deleteConnection(UUID connectionId) {
        Optional<FlowConnection> connection = connectionRepository.findById(connectionId);
        connection.ifPresent(connectionRepository::delete);
        return connection;
    }

    // Structural checks

    private void checkStructure(Flow flow, UUID nodeId, NodePayload payload) {
        if (payload instanceof HubPayload hub) {
            if (hub.hubId().isEmpty()) {
                throw new PayloadSchemaViolationException("hub_id must not be blank", nodeId);
            }
            if (findHub(flow.getId(), hub.hubId(), nodeId).isPresent()) {
                throw new StructuralViolationException(
                        "Hub id '" + hub.hubId() + "' is already used in flow " + flow.getId(), nodeId);
            }
        } else if (payload instanceof JumpPayload jump) {
            if (jump.hasTarget() && findHub(flow.getId(), jump.targetHubId(), null).isEmpty()) {
                throw new StructuralViolationException(
                        "Jump target hub '" + jump.targetHubId() + "' does not exist in flow " + flow.getId(), nodeId);
            }
        } else if (payload instanceof SubflowPayload subflow) {
            checkFlowReference(flow, nodeId, subflow.referencedFlowId());
        } else if (payload instanceof ExitPayload exit && exit.exitMode() == ExitMode.FLOW_REFERENCE) {
            checkFlowReference(flow, nodeId, exit.referencedFlowId());
        }
    }

    private void checkFlowReference(Flow flow, UUID nodeId, String referencedFlowId) {
        if (referencedFlowId == null) {
            return;
        }
        UUID target = UUID.fromString(referencedFlowId);
        if (target.equals(flow.getId())) {
            throw new StructuralViolationException("A flow cannot reference itself", nodeId);
        }
        flowRepository.findByIdAndDeletedAtIsNull(target)
                .filter(candidate -> candidate.getProjectId().equals(flow.getProjectId()))
                .orElseThrow(() -> new StructuralViolationException(
                        "Referenced flow " + target + " does not exist", nodeId));
        if (referencesReach(target, flow.getId())) {
            throw new StructuralViolationException(
                    "Referencing flow " + target + " would create a circular flow reference", nodeId);
        }
    }

    // Depth-first walk over subflow and exit references starting at {@code from}
    private boolean referencesReach(UUID from, UUID goal) {
        Deque<UUID> pending = new ArrayDeque<>();
        Set<UUID> visited = new HashSet<>();
        pending.push(from);
        while (!pending.isEmpty()) {
            UUID current = pending.pop();
            if (current.equals(goal)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (FlowNode node : nodeRepository.findByFlowIdAndNodeTypeInAndDeletedAtIsNull(current, FLOW_REFERENCING_TYPES)) {
                Object referenced = node.getPayload() != null ? node.getPayload().get("referenced_flow_id") : null;
                if (referenced != null) {
                    pending.push(UUID.fromString(referenced.toString()));
                }
            }
        }
        return false;
    }

    private Optional<FlowNode> findHub(UUID flowId, String hubId, UUID excludeNodeId) {
        return nodeRepository.findByFlowIdAndNodeTypeAndDeletedAtIsNull(flowId, NodeType.HUB).stream()
                .filter(node -> !node.getId().equals(excludeNodeId))
                .filter(node -> hubId.equals(hubIdOf(node)))
                .findFirst();
    }

    private String nextHubId(UUID flowId) {
        int max = 0;
        for (FlowNode hub : nodeRepository.findByFlowIdAndNodeTypeAndDeletedAtIsNull(flowId, NodeType.HUB)) {
            Matcher matcher = GENERATED_HUB_ID.matcher(hubIdOf(hub));
            if (matcher.matches()) {
                max = Math.max(max, Integer.parseInt(matcher.group(1)));
            }
        }
        return "hub_" + (max + 1);
    }

    /**
     * Points jumps aimed at {@code fromHubId} to {@code toHubId}. Trashed jumps are rewritten as
     * well; only the live ones are returned.
     */
    private List<FlowNode> retargetJumps(UUID flowId, String fromHubId, String toHubId) {
        List<FlowNode> updated = new ArrayList<>();
        for (FlowNode jump : nodeRepository.findByFlowIdAndNodeType(flowId, NodeType.JUMP)) {
            JumpPayload payload = (JumpPayload) nodeTypes.read(jump);
            if (fromHubId.equals(payload.targetHubId())) {
                jump.setPayload(nodeTypes.toMap(payload.withTarget(toHubId)));
                FlowNode saved = nodeRepository.save(jump);
                if (!saved.isDeleted()) {
                    updated.add(saved);
                }
            }
        }
        return updated;
    }

    private static String hubIdOf(FlowNode node) {
        return node.getPayload() != null ? Objects.toString(node.getPayload().get("hub_id"), "") : "";
    }

    // Lookups

    // Live flow, row-locked until the surrounding transaction ends
    private Flow lockLiveFlow(UUID flowId) {
        return flowRepository.findByIdForUpdate(flowId)
                .filter(flow -> !flow.isDeleted())
                .orElseThrow(() -> new FlowNotFoundException(flowId));
    }

    private Flow requireLiveFlow(UUID flowId) {
        return flowRepository.findByIdAndDeletedAtIsNull(flowId).orElseThrow(() -> new FlowNotFoundException(flowId));
    }

    private Flow requireFlowInProject(UUID flowId, UUID projectId) {
        Flow flow = requireLiveFlow(flowId);
        if (!flow.getProjectId().equals(projectId)) {
            throw new StructuralViolationException("Flow " + flowId + " belongs to another project", flowId);
        }
        return flow;
    }

    private FlowNode requireLiveNode(UUID nodeId) {
        return nodeRepository.findByIdAndDeletedAtIsNull(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    private void requireNodeInFlow(UUID flowId, UUID nodeId, String role) {
        nodeRepository.findByIdAndDeletedAtIsNull(nodeId)
                .filter(node -> node.getFlowId().equals(flowId))
                .orElseThrow(() -> new StructuralViolationException(
                        role + " node " + nodeId + " is not a live node of flow " + flowId, nodeId));
    }

    // Tree helpers

    private List<Flow> siblingsOf(UUID projectId, UUID parentId) {
        List<Flow> siblings = parentId == null
                ? flowRepository.findByProjectIdAndParentIdIsNullAndDeletedAtIsNullOrderByPositionAscNameAsc(projectId)
                : flowRepository.findByProjectIdAndParentIdAndDeletedAtIsNullOrderByPositionAscNameAsc(projectId, parentId);
        return new ArrayList<>(siblings);
    }

    private void placeAmongSiblings(Flow flow, List<Flow> siblings, int position) {
        List<Flow> ordered = new ArrayList<>(siblings);
        ordered.removeIf(sibling -> sibling.getId().equals(flow.getId()));
        ordered.add(Math.max(0, Math.min(position, ordered.size())), flow);
        renumber(ordered);
    }

    private void renumber(List<Flow> ordered) {
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).setPosition(i);
        }
        flowRepository.saveAll(ordered);
    }

    private boolean isAncestor(UUID candidateId, Flow start) {
        UUID cursor = start.getParentId();
        int depth = 0;
        while (cursor != null && depth++ < MAX_TREE_DEPTH) {
            if (cursor.equals(candidateId)) {
                return true;
            }
            cursor = flowRepository.findById(cursor).map(Flow::getParentId).orElse(null);
        }
        return false;
    }

    // Breadth-first over children; a child is included (and descended into) when it matches
    private List<Flow> collectSubtree(Flow root, Predicate<Flow> include) {
        List<Flow> result = new ArrayList<>();
        Deque<Flow> pending = new ArrayDeque<>();
        pending.add(root);
        while (!pending.isEmpty()) {
            Flow current = pending.poll();
            result.add(current);
            for (Flow child : flowRepository.findByParentId(current.getId())) {
                if (include.test(child)) {
                    pending.add(child);
                }
            }
        }
        return result;
    }

    private List<FlowTreeNode> buildTree(UUID parentId, Map<UUID, List<Flow>> childrenByParent) {
        List<FlowTreeNode> nodes = new ArrayList<>();
        for (Flow flow : childrenByParent.getOrDefault(parentId, List.of())) {
            nodes.add(new FlowTreeNode(flow.getId(), flow.getName(), flow.getShortcut(), flow.getPosition(),
                    flow.isMain(), buildTree(flow.getId(), childrenByParent)));
        }
        return nodes;
    }

    private String uniqueShortcut(UUID projectId, String base, UUID excludeId) {
        String candidate = base;
        int counter = 1;
        while (excludeId == null
                ? flowRepository.existsByProjectIdAndShortcutAndDeletedAtIsNull(projectId, candidate)
                : flowRepository.existsByProjectIdAndShortcutAndDeletedAtIsNullAndIdNot(projectId, candidate, excludeId)) {
            candidate = base + "-" + counter++;
        }
        return candidate;
    }

    /** "Act One: The Tavern" → "act-one-the-tavern" */
    static String toShortcut(String name) {
        String slug = name == null ? "" : name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s.-]", "")
                .trim()
                .replaceAll("\\s+", "-");
        return slug.isEmpty() ? "flow" : slug;
    }

    private static FlowNode newNode(UUID id, UUID flowId, NodeType type, double x, double y) {
        FlowNode node = new FlowNode();
        node.setId(id);
        node.setFlowId(flowId);
        node.setNodeType(type);
        node.setPositionX(x);
        node.setPositionY(y);
        return node;
    }

    private static Map<String, Object> defaultViewport() {
        Map<String, Object> viewport = new LinkedHashMap<>();
        viewport.put("x", 0.0);
        viewport.put("y", 0.0);
        viewport.put("zoom", 1.0);
        return viewport;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
