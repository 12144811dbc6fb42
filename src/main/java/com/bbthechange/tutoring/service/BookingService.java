package com.bbthechange.tutoring.service;

import com.bbthechange.tutoring.dto.AvailableSlotsDTO;
import com.bbthechange.tutoring.dto.BookRecurringRequest;
import com.bbthechange.tutoring.dto.BookSessionRequest;
import com.bbthechange.tutoring.dto.BookTrialRequest;
import com.bbthechange.tutoring.dto.ScheduleConflictDTO;
import com.bbthechange.tutoring.dto.SessionDTO;
import com.bbthechange.tutoring.model.RecurrenceFrequency;
import com.bbthechange.tutoring.model.SchedulingResult;
import com.bbthechange.tutoring.model.SessionStatus;

import java.time.LocalDate;
import java.util.List;

/**
 * Entry point for booking, rescheduling and cancelling tutoring sessions.
 *
 * Expected refusals (slot taken, too late to change, trial cap reached, lost
 * race) come back as a rejected {@link SchedulingResult}. Missing sessions or
 * subscriptions raise ResourceNotFoundException, acting on someone else's
 * session raises UnauthorizedException. Nothing is retried internally.
 */
public interface BookingService {

    /**
     * Book one lesson of a subscription.
     *
     * @param request The booking request
     * @param parentId The ID of the booking parent; must own the subscription
     * @return the new SCHEDULED session, or SLOT_UNAVAILABLE / CONCURRENT_BOOKING_CONFLICT
     */
    SchedulingResult<SessionDTO> bookSession(BookSessionRequest request, String parentId);

    /**
     * Book a trial lesson. Trial eligibility is checked before anything else,
     * so a parent at the cap gets TRIAL_LIMIT_REACHED without any slot lookup.
     */
    SchedulingResult<SessionDTO> bookTrial(BookTrialRequest request, String parentId);

    /**
     * Book {@code count} occurrences at weekly or biweekly spacing. All or nothing:
     * one unavailable occurrence rejects the request with SERIES_CONFLICT.
     */
    SchedulingResult<List<SessionDTO>> bookRecurring(BookRecurringRequest request, String parentId);

    /**
     * Move one SCHEDULED session. The notice rule applies to its current start time;
     * the new time only needs to be a free, future slot inside the tutor's availability.
     */
    SchedulingResult<SessionDTO> rescheduleSession(String sessionId, long newScheduledAt, String parentId);

    /**
     * Move every SCHEDULED session of a subscription to a new anchor date, atomically.
     */
    SchedulingResult<List<SessionDTO>> rescheduleSeries(String subscriptionId, LocalDate newAnchorDate,
                                                        RecurrenceFrequency frequency, String parentId);

    /**
     * Cancel one SCHEDULED session outside the notice window.
     *
     * @param reason optional; stored as "Canceled: {reason}"
     */
    SchedulingResult<SessionDTO> cancelSession(String sessionId, String reason, String parentId);

    /**
     * Cancel every SCHEDULED session of a subscription, atomically.
     */
    SchedulingResult<List<SessionDTO>> cancelSeries(String subscriptionId, String reason, String parentId);

    /**
     * Tutor records the outcome of a session that has started (COMPLETED or NO_SHOW).
     */
    SchedulingResult<SessionDTO> updateSessionStatus(String sessionId, SessionStatus status, String tutorId);

    /**
     * Bookable start times of a tutor in [horizonStart, horizonEnd).
     */
    AvailableSlotsDTO getAvailableSlots(String tutorId, long horizonStart, long horizonEnd, int durationMinutes);

    SessionDTO getSession(String sessionId, String userId);

    /**
     * Non-cancelled sessions of a subscription in chronological order.
     */
    List<SessionDTO> getSeries(String subscriptionId, String parentId);

    /**
     * Re-check that no two booked sessions of the tutor overlap in [from, to).
     *
     * @return overlapping pairs; empty when the schedule is consistent
     */
    List<ScheduleConflictDTO> findScheduleConflicts(String tutorId, long from, long to, String userId);
}
