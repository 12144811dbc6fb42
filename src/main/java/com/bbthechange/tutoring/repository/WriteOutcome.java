package com.bbthechange.tutoring.repository;

/**
 * Result of a version-guarded write against a tutor's schedule.
 */
public enum WriteOutcome {
    /** Committed. */
    OK,
    /** The tutor's schedule version moved since it was read; nothing was written. */
    CONFLICT
}
