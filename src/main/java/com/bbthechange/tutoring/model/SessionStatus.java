package com.bbthechange.tutoring.model;

/**
 * Lifecycle of a tutoring session. SCHEDULED is the only non-terminal state;
 * rescheduling keeps a session SCHEDULED and only moves its time.
 */
public enum SessionStatus {
    SCHEDULED,
    COMPLETED,
    NO_SHOW,
    CANCELLED;

    public boolean isTerminal() {
        return this != SCHEDULED;
    }

    /**
     * Whether a session in this status blocks the tutor's time.
     */
    public boolean occupiesTime() {
        return this != CANCELLED;
    }

    public boolean canTransitionTo(SessionStatus target) {
        return this == SCHEDULED && target != null && target != SCHEDULED;
    }
}
