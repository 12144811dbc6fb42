package com.bbthechange.tutoring.repository;

import com.bbthechange.tutoring.model.TrialUsage;

/**
 * Repository for per-parent trial lesson usage.
 */
public interface TrialUsageRepository {

    /**
     * Current usage for a parent. A parent who never booked a trial has a
     * usage record with trialsUsed = 0; this never returns null.
     */
    TrialUsage getTrialUsage(String parentId);

    /**
     * Record that the trial lesson {@code sessionId} used one of the parent's trials.
     * Idempotent per session id: the counter is incremented at most once per session,
     * and never past {@code cap}.
     *
     * @return COUNTED if this call incremented the counter, ALREADY_COUNTED if the session
     *         was counted before, LIMIT_REACHED if the parent had no trials left
     */
    TrialConsumption consumeTrial(String parentId, String sessionId, int cap);
}
