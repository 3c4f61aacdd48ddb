package com.narraflow.narraflow_backend.collab;

import com.narraflow.narraflow_backend.config.CollaborationProperties;
import com.narraflow.narraflow_backend.engine.FlowEventPublisher;
import com.narraflow.narraflow_backend.exception.LockConflictException;
import com.narraflow.narraflow_backend.exception.LockRequiredException;
import com.narraflow.narraflow_backend.exception.SessionNotJoinedException;
import com.narraflow.narraflow_backend.model.collab.*;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Realtime state of one open flow: who is present, who holds which node lease, and the event
 * sequence. Created by {@link FlowSessionRegistry} on the first join and dropped after the last leave.
 *
 * <p>Lease changes are atomic per node ({@link ConcurrentHashMap#compute}). Writes to one node
 * run under that node's lock and broadcast before releasing it, so observers see a node's
 * updates in commit order. Events are numbered and published under a single monitor.
 */
@Slf4j
public class FlowSession {

    private final UUID flowId;
    private final FlowEventPublisher publisher;
    private final LeaseClock clock;
    private final CollaborationProperties properties;

    private final Map<String, PresenceEntry> presence = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, EditLease> leases = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    private final Object publishMonitor = new Object();
    private long sequence;

    FlowSession(UUID flowId, FlowEventPublisher publisher, LeaseClock clock, CollaborationProperties properties) {
        this.flowId = flowId;
        this.publisher = publisher;
        this.clock = clock;
        this.properties = properties;
    }

    public UUID getFlowId() {
        return flowId;
    }

    // Presence

    PresenceEntry addPresence(String sessionId, SessionUser user) {
        PresenceEntry entry = new PresenceEntry(sessionId, user, flowId);
        entry.setLastSeenAt(clock.nowMillis());
        presence.put(sessionId, entry);
        return entry;
    }

    PresenceEntry removePresence(String sessionId) {
        return presence.remove(sessionId);
    }

    public boolean hasSession(String sessionId) {
        return sessionId != null && presence.containsKey(sessionId);
    }

    boolean isEmpty() {
        return presence.isEmpty();
    }

    public void touch(String sessionId) {
        PresenceEntry entry = sessionId != null ? presence.get(sessionId) : null;
        if (entry != null) {
            synchronized (entry) {
                entry.setLastSeenAt(clock.nowMillis());
            }
        }
    }

    public List<PresenceView> presenceViews() {
        List<PresenceView> views = new ArrayList<>();
        for (PresenceEntry entry : presence.values()) {
            synchronized (entry) {
                views.add(entry.view());
            }
        }
        views.sort(Comparator.comparing(view -> view.user().displayName()));
        return views;
    }

    /** Sessions with no activity for longer than {@code timeoutMs}. */
    List<String> idleSessions(long timeoutMs) {
        long now = clock.nowMillis();
        List<String> idle = new ArrayList<>();
        for (PresenceEntry entry : presence.values()) {
            synchronized (entry) {
                if (now - entry.getLastSeenAt() > timeoutMs) idle.add(entry.getSessionId());
            }
        }
        return idle;
    }

    // Leases

    /**
     * Grants the node's lease to the session if it is free or expired; the current holder
     * re-acquiring refreshes its TTL. Never blocks.
     *
     * @throws LockConflictException when another session holds a live lease
     */
    public EditLease acquire(UUID nodeId, String sessionId) {
        PresenceEntry entry = presence.get(sessionId);
        if (entry == null) {
            throw new SessionNotJoinedException(flowId, sessionId);
        }
        long now = clock.nowMillis();
        long expiresAt = now + properties.getLeaseTtlMs();
        boolean[] granted = new boolean[1];
        EditLease lease = leases.compute(nodeId, (id, current) -> {
            if (current == null || !current.isLive(now)) {
                granted[0] = true;
                return new EditLease(id, sessionId, entry.getUser(), now, expiresAt);
            }
            return current.heldBy(sessionId) ? current.extendTo(expiresAt) : current;
        });
        if (!lease.heldBy(sessionId)) {
            throw new LockConflictException(nodeId, lease);
        }
        touch(sessionId);
        if (granted[0]) {
            log.debug("Session {} locked node {} in flow {}", sessionId, nodeId, flowId);
            broadcast(FlowEventType.NODE_LOCKED, lockPayload(lease));
        }
        return lease;
    }

    /** Extends the holder's lease. Returns false, changing nothing, for anyone else. */
    public boolean heartbeat(UUID nodeId, String sessionId) {
        long expiresAt = clock.nowMillis() + properties.getLeaseTtlMs();
        boolean[] extended = new boolean[1];
        leases.computeIfPresent(nodeId, (id, current) -> {
            if (!current.heldBy(sessionId)) {
                return current;
            }
            extended[0] = true;
            return current.extendTo(expiresAt);
        });
        if (extended[0]) {
            touch(sessionId);
        }
        return extended[0];
    }

    /** Releases the holder's lease. Returns false, changing nothing, for anyone else. */
    public boolean release(UUID nodeId, String sessionId) {
        EditLease removed = removeLease(nodeId, lease -> lease.heldBy(sessionId));
        if (removed == null) {
            return false;
        }
        broadcast(FlowEventType.NODE_UNLOCKED, unlockPayload(removed, "released"));
        return true;
    }

    int releaseAll(String sessionId) {
        int released = 0;
        for (UUID nodeId : new ArrayList<>(leases.keySet())) {
            EditLease removed = removeLease(nodeId, lease -> lease.heldBy(sessionId));
            if (removed != null) {
                broadcast(FlowEventType.NODE_UNLOCKED, unlockPayload(removed, "session_closed"));
                released++;
            }
        }
        return released;
    }

    /** Drops every lease past its expiry and tells observers. */
    public int expireLeases() {
        long now = clock.nowMillis();
        int expired = 0;
        for (UUID nodeId : new ArrayList<>(leases.keySet())) {
            EditLease removed = removeLease(nodeId, lease -> !lease.isLive(now));
            if (removed != null) {
                log.warn("Lease on node {} held by session {} expired in flow {}", nodeId, removed.sessionId(), flowId);
                broadcast(FlowEventType.NODE_UNLOCKED, unlockPayload(removed, "expired"));
                expired++;
            }
        }
        return expired;
    }

    // Whoever held it, the node is gone
    void dropLease(UUID nodeId) {
        EditLease removed = removeLease(nodeId, lease -> true);
        if (removed != null) {
            broadcast(FlowEventType.NODE_UNLOCKED, unlockPayload(removed, "node_deleted"));
        }
        writeLocks.remove(nodeId);
    }

    public Optional<EditLease> liveLease(UUID nodeId) {
        EditLease lease = leases.get(nodeId);
        return lease != null && lease.isLive(clock.nowMillis()) ? Optional.of(lease) : Optional.empty();
    }

    public List<LeaseView> leaseViews() {
        long now = clock.nowMillis();
        return leases.values().stream()
                .filter(lease -> lease.isLive(now))
                .map(lease -> lease.view(now))
                .toList();
    }

    public LeaseView viewOf(EditLease lease) {
        return lease.view(clock.nowMillis());
    }

    private EditLease removeLease(UUID nodeId, Predicate<EditLease> condition) {
        EditLease[] removed = new EditLease[1];
        leases.computeIfPresent(nodeId, (id, current) -> {
            if (condition.test(current)) {
                removed[0] = current;
                return null;
            }
            return current;
        });
        return removed[0];
    }

    // Guarded writes

    /**
     * Runs a payload write for the node. The session must hold a live lease on it.
     *
     * @throws LockRequiredException otherwise; {@code write} is not run
     */
    public <T> T writeWithLease(UUID nodeId, String sessionId, Supplier<T> write) {
        ReentrantLock lock = writeLocks.computeIfAbsent(nodeId, id -> new ReentrantLock());
        lock.lock();
        try {
            EditLease lease = leases.get(nodeId);
            if (lease == null || !lease.heldBy(sessionId) || !lease.isLive(clock.nowMillis())) {
                throw new LockRequiredException(nodeId, sessionId);
            }
            touch(sessionId);
            return write.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a write that needs no lease (move, delete, system repair) unless another session is
     * editing the node. {@code sessionId} may be null for writes no session initiated.
     *
     * @throws LockConflictException when someone else holds a live lease
     */
    public <T> T writeUnlessLeasedByOther(UUID nodeId, String sessionId, Supplier<T> write) {
        ReentrantLock lock = writeLocks.computeIfAbsent(nodeId, id -> new ReentrantLock());
        lock.lock();
        try {
            EditLease lease = leases.get(nodeId);
            if (lease != null && lease.isLive(clock.nowMillis()) && !lease.heldBy(sessionId)) {
                throw new LockConflictException(nodeId, lease);
            }
            touch(sessionId);
            return write.get();
        } finally {
            lock.unlock();
        }
    }

    // Cursors

    /**
     * Records the cursor and broadcasts it unless this session broadcast one less than the
     * cursor interval ago; the pending position is then sent by {@link #flushCursors()}.
     */
    public boolean moveCursor(String sessionId, double x, double y) {
        PresenceEntry entry = presence.get(sessionId);
        if (entry == null) {
            return false;
        }
        long now = clock.nowMillis();
        synchronized (entry) {
            entry.setCursorX(x);
            entry.setCursorY(y);
            entry.setLastSeenAt(now);
            if (!cursorDue(entry, now)) {
                entry.setCursorDirty(true);
                return false;
            }
            sendCursor(entry, now);
            return true;
        }
    }

    public int flushCursors() {
        long now = clock.nowMillis();
        int flushed = 0;
        for (PresenceEntry entry : presence.values()) {
            synchronized (entry) {
                if (entry.isCursorDirty() && cursorDue(entry, now)) {
                    sendCursor(entry, now);
                    flushed++;
                }
            }
        }
        return flushed;
    }

    private boolean cursorDue(PresenceEntry entry, long now) {
        long last = entry.getLastCursorBroadcastAt();
        return last == PresenceEntry.NEVER || now - last >= properties.getCursorBroadcastIntervalMs();
    }

    // Caller holds the entry's monitor
    private void sendCursor(PresenceEntry entry, long now) {
        entry.setLastCursorBroadcastAt(now);
        entry.setCursorDirty(false);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", entry.getSessionId());
        payload.put("user_id", entry.getUser().userId());
        payload.put("x", entry.getCursorX());
        payload.put("y", entry.getCursorY());
        broadcast(FlowEventType.CURSOR_MOVED, payload);
    }

    // Events

    public FlowEvent broadcast(FlowEventType type, Map<String, Object> payload) {
        synchronized (publishMonitor) {
            FlowEvent event = new FlowEvent(type, flowId, ++sequence, payload);
            try {
                publisher.publish(event);
            } catch (RuntimeException e) {
                log.error("Failed to publish {} #{} for flow {}", type.wireName(), event.sequence(), flowId, e);
            }
            return event;
        }
    }

    public long currentSequence() {
        synchronized (publishMonitor) {
            return sequence;
        }
    }

    private static Map<String, Object> lockPayload(EditLease lease) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node_id", lease.nodeId());
        payload.put("session_id", lease.sessionId());
        payload.put("holder", lease.holder());
        return payload;
    }

    private static Map<String, Object> unlockPayload(EditLease lease, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node_id", lease.nodeId());
        payload.put("session_id", lease.sessionId());
        payload.put("reason", reason);
        return payload;
    }
}
