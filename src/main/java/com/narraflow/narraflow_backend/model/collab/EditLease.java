package com.narraflow.narraflow_backend.model.collab;

import java.util.UUID;

/**
 * Exclusive, time-bounded right of one session to edit one node's payload.
 * Times are monotonic milliseconds from the lease clock, not wall-clock time.
 */
public record EditLease(UUID nodeId,
                        String sessionId,
                        SessionUser holder,
                        long acquiredAt,
                        long expiresAt) {

    public boolean isLive(long now) {
        return now < expiresAt;
    }

    public boolean heldBy(String otherSessionId) {
        return sessionId.equals(otherSessionId);
    }

    public EditLease extendTo(long newExpiresAt) {
        return new EditLease(nodeId, sessionId, holder, acquiredAt, newExpiresAt);
    }

    public LeaseView view(long now) {
        return new LeaseView(nodeId, sessionId, holder, Math.max(0, expiresAt - now));
    }
}
