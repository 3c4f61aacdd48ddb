package com.narraflow.narraflow_backend.model.collab;

import lombok.Data;

import java.util.UUID;

/**
 * Presence of one session in a flow. Mutated only while holding the entry's monitor.
 */
@Data
public class PresenceEntry {

    public static final long NEVER = Long.MIN_VALUE;

    private final String sessionId;
    private final SessionUser user;
    private final UUID flowId;

    private Double cursorX;
    private Double cursorY;
    private long lastSeenAt;

    private long lastCursorBroadcastAt = NEVER;
    private boolean cursorDirty;

    public PresenceView view() {
        return new PresenceView(sessionId, user, cursorX, cursorY);
    }
}
