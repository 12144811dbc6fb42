package com.bbthechange.tutoring.model;

import java.util.Objects;

/**
 * New start time for one session of a series being moved.
 */
public final class SessionScheduleUpdate {

    private final String sessionId;
    private final long newScheduledAt;

    public SessionScheduleUpdate(String sessionId, long newScheduledAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.newScheduledAt = newScheduledAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getNewScheduledAt() {
        return newScheduledAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionScheduleUpdate that = (SessionScheduleUpdate) o;
        return newScheduledAt == that.newScheduledAt && sessionId.equals(that.sessionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, newScheduledAt);
    }

    @Override
    public String toString() {
        return sessionId + "@" + newScheduledAt;
    }
}
