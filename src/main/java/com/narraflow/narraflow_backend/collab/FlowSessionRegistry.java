package com.narraflow.narraflow_backend.collab;

import com.narraflow.narraflow_backend.config.CollaborationProperties;
import com.narraflow.narraflow_backend.engine.FlowEventPublisher;
import com.narraflow.narraflow_backend.exception.SessionNotJoinedException;
import com.narraflow.narraflow_backend.model.collab.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Open flows of this instance. A realtime session edits one flow at a time; joining another
 * flow leaves the previous one.
 */
@Slf4j
@Component
public class FlowSessionRegistry {

    private static final int FLOW_LOCK_STRIPES = 64;

    private final FlowEventPublisher publisher;
    private final LeaseClock clock;
    private final CollaborationProperties properties;

    private final ConcurrentHashMap<UUID, FlowSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, UUID> flowBySession = new ConcurrentHashMap<>();
    private final ReentrantLock[] flowLocks = new ReentrantLock[FLOW_LOCK_STRIPES];

    public FlowSessionRegistry(FlowEventPublisher publisher, LeaseClock clock, CollaborationProperties properties) {
        this.publisher = publisher;
        this.clock = clock;
        this.properties = properties;
        for (int i = 0; i < flowLocks.length; i++) {
            flowLocks[i] = new ReentrantLock();
        }
    }

    public FlowSession join(UUID flowId, String sessionId, SessionUser user) {
        UUID previous = flowBySession.put(sessionId, flowId);
        if (previous != null && !previous.equals(flowId)) {
            leave(previous, sessionId);
        }
        PresenceEntry[] joined = new PresenceEntry[1];
        FlowSession session = sessions.compute(flowId, (id, current) -> {
            FlowSession target = current != null ? current : new FlowSession(id, publisher, clock, properties);
            joined[0] = target.addPresence(sessionId, user);
            return target;
        });
        session.broadcast(FlowEventType.PRESENCE_DIFF, presenceDiff(List.of(joined[0].view()), List.of()));
        log.info("Session {} ({}) joined flow {}", sessionId, user.displayName(), flowId);
        return session;
    }

    /** Releases the session's leases and removes its presence. The flow is closed after its last session. */
    public boolean leave(UUID flowId, String sessionId) {
        flowBySession.remove(sessionId, flowId);
        FlowSession session = sessions.get(flowId);
        if (session == null || !session.hasSession(sessionId)) {
            return false;
        }
        int released = session.releaseAll(sessionId);
        boolean[] removed = new boolean[1];
        sessions.computeIfPresent(flowId, (id, current) -> {
            removed[0] = current.removePresence(sessionId) != null;
            return current.isEmpty() ? null : current;
        });
        if (removed[0]) {
            session.broadcast(FlowEventType.PRESENCE_DIFF, presenceDiff(List.of(), List.of(sessionId)));
            log.info("Session {} left flow {} ({} lease(s) released)", sessionId, flowId, released);
        }
        return removed[0];
    }

    public void disconnect(String sessionId) {
        UUID flowId = flowBySession.get(sessionId);
        if (flowId != null) {
            leave(flowId, sessionId);
        }
    }

    public Optional<FlowSession> find(UUID flowId) {
        return Optional.ofNullable(sessions.get(flowId));
    }

    /** The open flow, which {@code sessionId} must have joined. */
    public FlowSession require(UUID flowId, String sessionId) {
        FlowSession session = sessions.get(flowId);
        if (session == null || !session.hasSession(sessionId)) {
            throw new SessionNotJoinedException(flowId, sessionId);
        }
        return session;
    }

    /**
     * Broadcasts through the flow's session. A flow nobody has open has no sequence, so its
     * events carry sequence 0.
     */
    public FlowEvent broadcast(UUID flowId, FlowEventType type, Map<String, Object> payload) {
        FlowSession session = sessions.get(flowId);
        if (session != null) {
            return session.broadcast(type, payload);
        }
        FlowEvent event = new FlowEvent(type, flowId, 0, payload);
        publisher.publish(event);
        return event;
    }

    /** Runs a structural flow-level change while no other such change to the same flow runs. */
    public <T> T withFlowLock(UUID flowId, Supplier<T> action) {
        ReentrantLock lock = flowLocks[Math.floorMod(flowId.hashCode(), FLOW_LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Expires overdue leases and drops sessions that stopped talking to us. */
    public void sweep() {
        for (FlowSession session : List.copyOf(sessions.values())) {
            try {
                session.expireLeases();
                for (String sessionId : session.idleSessions(properties.getSessionTimeoutMs())) {
                    log.warn("Dropping idle session {} from flow {}", sessionId, session.getFlowId());
                    leave(session.getFlowId(), sessionId);
                }
            } catch (RuntimeException e) {
                log.warn("Lease sweep failed for flow {}", session.getFlowId(), e);
            }
        }
    }

    public void flushCursors() {
        for (FlowSession session : sessions.values()) {
            try {
                session.flushCursors();
            } catch (RuntimeException e) {
                log.warn("Cursor flush failed for flow {}", session.getFlowId(), e);
            }
        }
    }

    public int openFlowCount() {
        return sessions.size();
    }

    private static Map<String, Object> presenceDiff(List<PresenceView> joins, List<String> leaves) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("joins", joins);
        payload.put("leaves", leaves);
        return payload;
    }
}
