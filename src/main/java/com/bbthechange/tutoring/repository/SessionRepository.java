package com.bbthechange.tutoring.repository;

import com.bbthechange.tutoring.model.Session;
import com.bbthechange.tutoring.model.SessionScheduleUpdate;
import com.bbthechange.tutoring.model.SessionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository for booked sessions and the per-tutor schedule version that
 * serializes writes to a tutor's calendar.
 *
 * Writes that claim or move time take the schedule version read before
 * validation and commit only if it is unchanged, bumping it in the same
 * transaction. They report {@link WriteOutcome#CONFLICT} instead of throwing
 * when another write got there first.
 */
public interface SessionRepository {

    // DynamoDB caps a transaction at 100 items and one of them is the schedule version
    int MAX_SESSIONS_PER_WRITE = 99;

    Optional<Session> findById(String sessionId);

    /**
     * Non-cancelled sessions of a tutor whose occupied interval overlaps [rangeStart, rangeEnd).
     *
     * @param excludeSessionId session to leave out of the result, may be null
     * @return sessions ordered by scheduledAt
     */
    List<Session> findBookedSessions(String tutorId, long rangeStart, long rangeEnd, String excludeSessionId);

    /**
     * Every session of a subscription, any status, ordered by scheduledAt.
     */
    List<Session> findBySubscriptionId(String subscriptionId);

    /**
     * Current schedule version of a tutor; 0 if the tutor never had a booking.
     */
    long getScheduleVersion(String tutorId);

    WriteOutcome insertSession(Session session, long expectedVersion);

    /**
     * Insert several sessions of one tutor in a single transaction.
     */
    WriteOutcome insertSessions(String tutorId, List<Session> sessions, long expectedVersion);

    WriteOutcome updateSessionSchedule(String tutorId, String sessionId, long newScheduledAt, long expectedVersion);

    /**
     * Move every session of a series in one transaction; either all move or none do.
     */
    WriteOutcome updateSeriesSchedule(String tutorId, List<SessionScheduleUpdate> updates, long expectedVersion);

    /**
     * Set the status of a SCHEDULED session. Does not touch the schedule version.
     *
     * @return CONFLICT if the session is no longer SCHEDULED
     */
    WriteOutcome updateSessionStatus(String sessionId, SessionStatus status, String notes);

    /**
     * Cancel several SCHEDULED sessions in one transaction.
     *
     * @return CONFLICT if any of them is no longer SCHEDULED; nothing is written then
     */
    WriteOutcome cancelSessions(List<String> sessionIds, String notes);
}
