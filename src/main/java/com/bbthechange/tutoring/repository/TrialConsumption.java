package com.bbthechange.tutoring.repository;

/**
 * Result of counting a trial lesson against a parent's cap.
 */
public enum TrialConsumption {
    /** The counter was incremented for this session. */
    COUNTED,
    /** The session had been counted before; the counter is unchanged. */
    ALREADY_COUNTED,
    /** The parent had already used every trial; the counter is unchanged. */
    LIMIT_REACHED
}
