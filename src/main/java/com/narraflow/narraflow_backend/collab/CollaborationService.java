package com.narraflow.narraflow_backend.collab;

import com.narraflow.narraflow_backend.exception.LockRequiredException;
import com.narraflow.narraflow_backend.model.collab.*;
import com.narraflow.narraflow_backend.model.domain.Flow;
import com.narraflow.narraflow_backend.model.domain.FlowConnection;
import com.narraflow.narraflow_backend.model.domain.FlowNode;
import com.narraflow.narraflow_backend.model.dto.*;
import com.narraflow.narraflow_backend.service.FlowGraphService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Supplier;

/**
 * Realtime editing on top of {@link FlowGraphService}: checks leases before node writes and
 * broadcasts every committed change to the flow's collaborators.
 *
 * <p>Payload edits require the caller's live lease. Moves, deletes and system rewrites need
 * none but are refused while another session holds the node. Edits that touch hub ids, jump
 * targets or connection endpoints take the flow lock before the node lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollaborationService {

    private final FlowSessionRegistry registry;
    private final FlowGraphService flowGraphService;

    // Sessions

    public FlowSnapshot join(UUID flowId, String sessionId, SessionUser user) {
        flowGraphService.getFlow(flowId);
        FlowSession session = registry.join(flowId, sessionId, user);
        // Sequence before graph: events past it may already be in the graph, never the reverse
        long sequence = session.currentSequence();
        FlowGraphDto graph = flowGraphService.getGraph(flowId);
        return new FlowSnapshot(graph, session.leaseViews(), session.presenceViews(), sequence);
    }

    public boolean leave(UUID flowId, String sessionId) {
        return registry.leave(flowId, sessionId);
    }

    public void disconnect(String sessionId) {
        registry.disconnect(sessionId);
    }

    public void moveCursor(UUID flowId, String sessionId, double x, double y) {
        registry.find(flowId).ifPresent(session -> session.moveCursor(sessionId, x, y));
    }

    public void ping(UUID flowId, String sessionId) {
        registry.require(flowId, sessionId).touch(sessionId);
    }

    // Leases

    public LeaseView acquireLock(UUID flowId, UUID nodeId, String sessionId) {
        flowGraphService.requireNodeOfFlow(flowId, nodeId);
        FlowSession session = registry.require(flowId, sessionId);
        return session.viewOf(session.acquire(nodeId, sessionId));
    }

    public boolean heartbeat(UUID flowId, UUID nodeId, String sessionId) {
        return registry.find(flowId).map(session -> session.heartbeat(nodeId, sessionId)).orElse(false);
    }

    public boolean releaseLock(UUID flowId, UUID nodeId, String sessionId) {
        return registry.find(flowId).map(session -> session.release(nodeId, sessionId)).orElse(false);
    }

    public List<LeaseView> listLocks(UUID flowId) {
        flowGraphService.getFlow(flowId);
        return registry.find(flowId).map(FlowSession::leaseViews).orElse(List.of());
    }

    // Nodes

    public FlowNode createNode(UUID flowId, String sessionId, CreateNodeRequest request) {
        return registry.withFlowLock(flowId, () -> {
            FlowNode node = flowGraphService.createNode(flowId, request);
            registry.broadcast(flowId, FlowEventType.NODE_CREATED, nodeEvent(node, sessionId));
            return node;
        });
    }

    /**
     * Saves a payload edit from a session holding the node's lease.
     *
     * @throws LockRequiredException when the session holds no live lease; nothing is written
     */
    public FlowNode updateNodePayload(UUID flowId, UUID nodeId, String sessionId, Map<String, Object> payload) {
        flowGraphService.requireNodeOfFlow(flowId, nodeId);
        FlowSession session = registry.find(flowId)
                .orElseThrow(() -> new LockRequiredException(nodeId, sessionId));
        return registry.withFlowLock(flowId, () -> session.writeWithLease(nodeId, sessionId, () -> {
            PayloadUpdate update = flowGraphService.updateNodePayload(nodeId, payload);
            publishPayloadUpdate(session::broadcast, update, sessionId);
            return update.node();
        }));
    }

    /** Payload rewrite no session asked for (reference repair). Refused while a session edits the node. */
    public FlowNode applySystemPayload(UUID flowId, UUID nodeId, Map<String, Object> payload) {
        flowGraphService.requireNodeOfFlow(flowId, nodeId);
        return registry.withFlowLock(flowId, () -> writeUnlessLeased(flowId, nodeId, null, () -> {
            PayloadUpdate update = flowGraphService.updateNodePayload(nodeId, payload);
            publishPayloadUpdate((type, event) -> registry.broadcast(flowId, type, event), update, null);
            return update.node();
        }));
    }

    public FlowNode updateNodePosition(UUID flowId, UUID nodeId, String sessionId, NodePositionRequest position) {
        flowGraphService.requireNodeOfFlow(flowId, nodeId);
        return writeUnlessLeased(flowId, nodeId, sessionId, () -> {
            FlowNode node = flowGraphService.updateNodePosition(nodeId, position);
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("node_id", node.getId());
            event.put("x", node.getPositionX());
            event.put("y", node.getPositionY());
            event.put("version", node.getVersion());
            event.put("session_id", sessionId);
            registry.broadcast(flowId, FlowEventType.NODE_MOVED, event);
            return node;
        });
    }

    public NodeDeletion deleteNode(UUID flowId, UUID nodeId, String sessionId) {
        flowGraphService.requireAnyNodeOfFlow(flowId, nodeId);
        NodeDeletion deletion = registry.withFlowLock(flowId, () -> writeUnlessLeased(flowId, nodeId, sessionId, () -> {
            NodeDeletion result = flowGraphService.deleteNode(nodeId);
            if (!result.alreadyDeleted()) {
                Map<String, Object> event = new LinkedHashMap<>();
                event.put("node_id", nodeId);
                event.put("session_id", sessionId);
                registry.broadcast(flowId, FlowEventType.NODE_DELETED, event);
                for (FlowConnection connection : result.removedConnections()) {
                    registry.broadcast(flowId, FlowEventType.CONNECTION_DELETED, connectionDeleted(connection.getId(), sessionId));
                }
                for (FlowNode jump : result.updatedJumps()) {
                    registry.broadcast(flowId, FlowEventType.NODE_UPDATED, nodeEvent(jump, sessionId));
                }
            }
            return result;
        }));
        registry.find(flowId).ifPresent(session -> session.dropLease(nodeId));
        return deletion;
    }

    public FlowNode restoreNode(UUID flowId, UUID nodeId, String sessionId) {
        flowGraphService.requireAnyNodeOfFlow(flowId, nodeId);
        return registry.withFlowLock(flowId, () -> writeUnlessLeased(flowId, nodeId, sessionId, () -> {
            boolean wasDeleted = flowGraphService.requireAnyNodeOfFlow(flowId, nodeId).isDeleted();
            FlowNode node = flowGraphService.restoreNode(nodeId);
            if (wasDeleted) {
                registry.broadcast(flowId, FlowEventType.NODE_RESTORED, nodeEvent(node, sessionId));
            }
            return node;
        }));
    }

    // Connections

    public FlowConnection createConnection(UUID flowId, String sessionId, CreateConnectionRequest request) {
        return registry.withFlowLock(flowId, () -> {
            FlowConnection connection = flowGraphService.createConnection(flowId, request);
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("connection", connection);
            event.put("session_id", sessionId);
            registry.broadcast(flowId, FlowEventType.CONNECTION_CREATED, event);
            return connection;
        });
    }

    public boolean deleteConnection(UUID flowId, UUID connectionId, String sessionId) {
        flowGraphService.getFlow(flowId);
        Optional<FlowConnection> removed = flowGraphService.deleteConnection(connectionId);
        removed.ifPresent(connection ->
                registry.broadcast(flowId, FlowEventType.CONNECTION_DELETED, connectionDeleted(connection.getId(), sessionId)));
        return removed.isPresent();
    }

    // Flows

    public Flow renameFlow(UUID flowId, String name) {
        return registry.withFlowLock(flowId, () -> refreshed(flowGraphService.renameFlow(flowId, name), "renamed"));
    }

    public Flow moveFlow(UUID flowId, MoveFlowRequest request) {
        return registry.withFlowLock(flowId, () -> refreshed(flowGraphService.moveFlow(flowId, request), "moved"));
    }

    public Flow deleteFlow(UUID flowId) {
        return registry.withFlowLock(flowId, () -> refreshed(flowGraphService.deleteFlow(flowId), "deleted"));
    }

    public Flow restoreFlow(UUID flowId) {
        return registry.withFlowLock(flowId, () -> refreshed(flowGraphService.restoreFlow(flowId), "restored"));
    }

    public void hardDeleteFlow(UUID flowId) {
        registry.withFlowLock(flowId, () -> {
            flowGraphService.hardDeleteFlow(flowId);
            registry.broadcast(flowId, FlowEventType.FLOW_REFRESH, Map.of("reason", "purged"));
            return null;
        });
    }

    private Flow refreshed(Flow flow, String reason) {
        registry.broadcast(flow.getId(), FlowEventType.FLOW_REFRESH, Map.of("reason", reason));
        return flow;
    }

    private <T> T writeUnlessLeased(UUID flowId, UUID nodeId, String sessionId, Supplier<T> write) {
        Optional<FlowSession> session = registry.find(flowId);
        if (session.isEmpty()) {
            return write.get();
        }
        return session.get().writeUnlessLeasedByOther(nodeId, sessionId, write);
    }

    private static void publishPayloadUpdate(EventSink sink, PayloadUpdate update, String sessionId) {
        sink.send(FlowEventType.NODE_UPDATED, nodeEvent(update.node(), sessionId));
        for (FlowNode jump : update.updatedJumps()) {
            sink.send(FlowEventType.NODE_UPDATED, nodeEvent(jump, sessionId));
        }
    }

    private static Map<String, Object> nodeEvent(FlowNode node, String sessionId) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("node", node);
        event.put("session_id", sessionId);
        return event;
    }

    private static Map<String, Object> connectionDeleted(UUID connectionId, String sessionId) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("connection_id", connectionId);
        event.put("session_id", sessionId);
        return event;
    }

    @FunctionalInterface
    private interface EventSink {
        void send(FlowEventType type, Map<String, Object> payload);
    }
}
