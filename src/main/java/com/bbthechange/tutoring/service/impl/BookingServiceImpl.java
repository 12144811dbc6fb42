package com.bbthechange.tutoring.service.impl;

import com.bbthechange.tutoring.config.SchedulingProperties;
import com.bbthechange.tutoring.dto.*;
import com.bbthechange.tutoring.exception.ResourceNotFoundException;
import com.bbthechange.tutoring.exception.SessionNotFoundException;
import com.bbthechange.tutoring.exception.UnauthorizedException;
import com.bbthechange.tutoring.exception.ValidationException;
import com.bbthechange.tutoring.model.*;
import com.bbthechange.tutoring.repository.AvailabilityWindowRepository;
import com.bbthechange.tutoring.repository.SessionRepository;
import com.bbthechange.tutoring.repository.SubscriptionRepository;
import com.bbthechange.tutoring.repository.TimeBlockRepository;
import com.bbthechange.tutoring.repository.TrialConsumption;
import com.bbthechange.tutoring.repository.WriteOutcome;
import com.bbthechange.tutoring.service.BookingService;
import com.bbthechange.tutoring.service.ConflictDetector;
import com.bbthechange.tutoring.service.ModificationPolicyGuard;
import com.bbthechange.tutoring.service.SeriesRescheduler;
import com.bbthechange.tutoring.service.SlotResolver;
import com.bbthechange.tutoring.service.TrialEligibilityService;
import com.bbthechange.tutoring.util.BookingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Implementation of BookingService.
 *
 * Every operation that claims or moves time reads the tutor's schedule version
 * first, validates against a fresh read of windows, bookings and time blocks,
 * then commits guarded by that version. A write that loses the race is reported
 * as CONCURRENT_BOOKING_CONFLICT; the caller decides whether to try again.
 *
 * Authorization: parents act on their own sessions and subscriptions, tutors
 * record outcomes of their own sessions.
 */
@Service
public class BookingServiceImpl implements BookingService {

    private static final Logger logger = LoggerFactory.getLogger(BookingServiceImpl.class);

    private static final long MILLIS_PER_DAY = 24L * 60 * 60 * 1000;
    private static final String CANCELED_BY_PARENT = "Canceled by parent";
    private static final String CANCELED_TRIAL_LIMIT = "Canceled: trial limit reached";

    private final SessionRepository sessionRepository;
    private final AvailabilityWindowRepository windowRepository;
    private final TimeBlockRepository timeBlockRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final TrialEligibilityService trialEligibilityService;
    private final SlotResolver slotResolver;
    private final ConflictDetector conflictDetector;
    private final ModificationPolicyGuard modificationPolicyGuard;
    private final SeriesRescheduler seriesRescheduler;
    private final SchedulingProperties schedulingProperties;
    private final BookingMetrics bookingMetrics;
    private final Clock clock;

    @Autowired
    public BookingServiceImpl(
            SessionRepository sessionRepository,
            AvailabilityWindowRepository windowRepository,
            TimeBlockRepository timeBlockRepository,
            SubscriptionRepository subscriptionRepository,
            TrialEligibilityService trialEligibilityService,
            SlotResolver slotResolver,
            ConflictDetector conflictDetector,
            ModificationPolicyGuard modificationPolicyGuard,
            SeriesRescheduler seriesRescheduler,
            SchedulingProperties schedulingProperties,
            BookingMetrics bookingMetrics,
            Clock clock) {
        this.sessionRepository = sessionRepository;
        this.windowRepository = windowRepository;
        this.timeBlockRepository = timeBlockRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.trialEligibilityService = trialEligibilityService;
        this.slotResolver = slotResolver;
        this.conflictDetector = conflictDetector;
        this.modificationPolicyGuard = modificationPolicyGuard;
        this.seriesRescheduler = seriesRescheduler;
        this.schedulingProperties = schedulingProperties;
        this.bookingMetrics = bookingMetrics;
        this.clock = clock;
    }

    @Override
    public SchedulingResult<SessionDTO> bookSession(BookSessionRequest request, String parentId) {
        logger.info("Parent {} booking session with tutor {} at {}",
            parentId, request.getTutorId(), request.getScheduledAt());

        Subscription subscription = requireOwnedSubscription(request.getSubscriptionId(), parentId);
        if (!subscription.getTutorId().equals(request.getTutorId())) {
            throw new ValidationException("Subscription " + subscription.getSubscriptionId()
                + " is not with tutor " + request.getTutorId());
        }

        long now = clock.millis();
        long version = sessionRepository.getScheduleVersion(request.getTutorId());

        Optional<SchedulingRejection> slotProblem = validateSlot(request.getTutorId(), request.getScheduledAt(),
            request.getDurationMinutes(), null, now);
        if (slotProblem.isPresent()) {
            return reject("bookSession", slotProblem.get());
        }

        Session session = new Session(request.getTutorId(), parentId, subscription.getSubscriptionId(),
            request.getScheduledAt(), request.getDurationMinutes());
        session.setStudentName(request.getStudentName());

        return commitNewSession("bookSession", session, version);
    }

    @Override
    public SchedulingResult<SessionDTO> bookTrial(BookTrialRequest request, String parentId) {
        logger.info("Parent {} booking trial with tutor {} at {}",
            parentId, request.getTutorId(), request.getScheduledAt());

        TrialEligibilityDTO eligibility = trialEligibilityService.checkEligibility(parentId, request.getCourseId());
        if (!eligibility.isEligible()) {
            return reject("bookTrial", SchedulingRejection.Reason.TRIAL_LIMIT_REACHED,
                String.format("All %d trial lessons have been used", eligibility.getTrialsCap()));
        }

        int duration = request.getDurationMinutes() != null
            ? request.getDurationMinutes()
            : schedulingProperties.getTrialDurationMinutes();
        long now = clock.millis();
        long version = sessionRepository.getScheduleVersion(request.getTutorId());

        Optional<SchedulingRejection> slotProblem = validateSlot(request.getTutorId(), request.getScheduledAt(),
            duration, null, now);
        if (slotProblem.isPresent()) {
            return reject("bookTrial", slotProblem.get());
        }

        Session session = new Session(request.getTutorId(), parentId, null, request.getScheduledAt(), duration);
        session.setTrial(true);
        session.setCourseId(request.getCourseId());
        session.setStudentName(request.getStudentName());

        WriteOutcome outcome = sessionRepository.insertSession(session, version);
        if (outcome == WriteOutcome.CONFLICT) {
            return rejectConcurrent("bookTrial", session.getTutorId());
        }

        // A trial with another tutor can take the last place between the eligibility check and here
        TrialConsumption consumption = trialEligibilityService.consumeTrial(parentId, session.getSessionId());
        if (consumption == TrialConsumption.LIMIT_REACHED) {
            releaseTrialSession(session);
            return reject("bookTrial", SchedulingRejection.Reason.TRIAL_LIMIT_REACHED,
                String.format("All %d trial lessons have been used", schedulingProperties.getTrialCap()));
        }

        bookingMetrics.recordSuccess("bookTrial");
        logger.info("Booked trial session {} with tutor {} at {}",
            session.getSessionId(), session.getTutorId(), session.getScheduledAt());
        return SchedulingResult.success(new SessionDTO(session));
    }

    private void releaseTrialSession(Session session) {
        WriteOutcome outcome = sessionRepository.cancelSessions(List.of(session.getSessionId()), CANCELED_TRIAL_LIMIT);
        if (outcome == WriteOutcome.CONFLICT) {
            logger.warn("Trial session {} over the cap was no longer scheduled when releasing it",
                session.getSessionId());
        } else {
            logger.info("Released trial session {} for parent {}: trial cap reached",
                session.getSessionId(), session.getParentId());
        }
    }

    @Override
    public SchedulingResult<List<SessionDTO>> bookRecurring(BookRecurringRequest request, String parentId) {
        logger.info("Parent {} booking {} {} sessions with tutor {} from {}", parentId, request.getCount(),
            request.getFrequency(), request.getTutorId(), request.getFirstScheduledAt());

        Subscription subscription = requireOwnedSubscription(request.getSubscriptionId(), parentId);
        if (!subscription.getTutorId().equals(request.getTutorId())) {
            throw new ValidationException("Subscription " + subscription.getSubscriptionId()
                + " is not with tutor " + request.getTutorId());
        }
        if (request.getCount() > SessionRepository.MAX_SESSIONS_PER_WRITE) {
            return reject("bookRecurring", SchedulingRejection.Reason.SERIES_CONFLICT,
                "A series can hold at most " + SessionRepository.MAX_SESSIONS_PER_WRITE + " sessions");
        }

        ZoneId zone = schedulingProperties.getZone();
        ZonedDateTime first = Instant.ofEpochMilli(request.getFirstScheduledAt()).atZone(zone);
        List<Long> starts = new ArrayList<>();
        for (int k = 0; k < request.getCount(); k++) {
            starts.add(first.plusDays((long) k * request.getFrequency().getIntervalDays()).toInstant().toEpochMilli());
        }

        long now = clock.millis();
        long lastStart = starts.get(starts.size() - 1);
        if (beyondHorizon(lastStart, now)) {
            return reject("bookRecurring", SchedulingRejection.Reason.SERIES_CONFLICT,
                "Last occurrence is more than " + schedulingProperties.getMaxHorizonDays() + " days ahead");
        }

        long version = sessionRepository.getScheduleVersion(request.getTutorId());
        long rangeEnd = Interval.ofMinutes(lastStart, request.getDurationMinutes()).getEnd();
        List<AvailabilityWindow> windows = windowRepository.findByTutorId(request.getTutorId());
        List<Session> booked = sessionRepository.findBookedSessions(request.getTutorId(), starts.get(0), rangeEnd, null);
        List<TimeBlock> blocks = timeBlockRepository.findOverlapping(request.getTutorId(), starts.get(0), rangeEnd);

        List<Session> sessions = new ArrayList<>();
        for (int k = 0; k < starts.size(); k++) {
            long start = starts.get(k);
            SlotResolver.SlotVerdict verdict = slotResolver.checkSlot(windows, booked, blocks, start,
                request.getDurationMinutes(), now, null);
            if (verdict != SlotResolver.SlotVerdict.BOOKABLE) {
                return reject("bookRecurring", SchedulingRejection.Reason.SERIES_CONFLICT,
                    String.format("Occurrence %d of %d at %s is not available (%s)",
                        k + 1, starts.size(), Instant.ofEpochMilli(start).atZone(zone), verdict.describe()));
            }
            Session session = new Session(request.getTutorId(), parentId, subscription.getSubscriptionId(),
                start, request.getDurationMinutes());
            session.setStudentName(request.getStudentName());
            sessions.add(session);
        }

        WriteOutcome outcome = sessionRepository.insertSessions(request.getTutorId(), sessions, version);
        if (outcome == WriteOutcome.CONFLICT) {
            return rejectConcurrent("bookRecurring", request.getTutorId());
        }

        bookingMetrics.recordSuccess("bookRecurring");
        logger.info("Booked {} sessions for subscription {}", sessions.size(), subscription.getSubscriptionId());
        return SchedulingResult.success(toDTOs(sessions));
    }

    @Override
    public SchedulingResult<SessionDTO> rescheduleSession(String sessionId, long newScheduledAt, String parentId) {
        logger.info("Parent {} rescheduling session {} to {}", parentId, sessionId, newScheduledAt);

        Session session = requireOwnedSession(sessionId, parentId);
        if (!session.isScheduled()) {
            return reject("rescheduleSession", SchedulingRejection.Reason.INVALID_STATE,
                "Session is " + session.getStatus() + " and can no longer be rescheduled");
        }

        long now = clock.millis();
        if (!modificationPolicyGuard.canModify(session.getScheduledAt(), now)) {
            return reject("rescheduleSession", tooLate(session, now));
        }

        long version = sessionRepository.getScheduleVersion(session.getTutorId());
        Optional<SchedulingRejection> slotProblem = validateSlot(session.getTutorId(), newScheduledAt,
            session.getDuration(), sessionId, now);
        if (slotProblem.isPresent()) {
            return reject("rescheduleSession", slotProblem.get());
        }

        WriteOutcome outcome = sessionRepository.updateSessionSchedule(session.getTutorId(), sessionId, newScheduledAt, version);
        if (outcome == WriteOutcome.CONFLICT) {
            return rejectConcurrent("rescheduleSession", session.getTutorId());
        }

        session.setScheduledAt(newScheduledAt);
        bookingMetrics.recordSuccess("rescheduleSession");
        return SchedulingResult.success(new SessionDTO(session));
    }

    @Override
    public SchedulingResult<List<SessionDTO>> rescheduleSeries(String subscriptionId, LocalDate newAnchorDate,
                                                               RecurrenceFrequency frequency, String parentId) {
        logger.info("Parent {} rescheduling series {} to start {} ({})", parentId, subscriptionId, newAnchorDate, frequency);

        Subscription subscription = requireOwnedSubscription(subscriptionId, parentId);
        List<Session> scheduled = findScheduledSessions(subscriptionId);
        if (scheduled.isEmpty()) {
            return reject("rescheduleSeries", SchedulingRejection.Reason.INVALID_STATE,
                "Series has no scheduled sessions to move");
        }
        if (scheduled.size() > SessionRepository.MAX_SESSIONS_PER_WRITE) {
            return reject("rescheduleSeries", SchedulingRejection.Reason.SERIES_CONFLICT,
                "Series has more than " + SessionRepository.MAX_SESSIONS_PER_WRITE + " sessions to move");
        }

        long now = clock.millis();
        Optional<Session> blocking = modificationPolicyGuard.findFirstBlocking(scheduled, now,
            modificationPolicyGuard.getMinNoticeHours());
        if (blocking.isPresent()) {
            return reject("rescheduleSeries", tooLate(blocking.get(), now));
        }

        ZoneId zone = schedulingProperties.getZone();
        int spanDays = (scheduled.size() - 1) * frequency.getIntervalDays();
        long rangeStart = newAnchorDate.atStartOfDay(zone).toInstant().toEpochMilli();
        long rangeEnd = newAnchorDate.plusDays(spanDays + 1L).atStartOfDay(zone).toInstant().toEpochMilli();
        if (beyondHorizon(rangeEnd - MILLIS_PER_DAY, now)) {
            return reject("rescheduleSeries", SchedulingRejection.Reason.SERIES_CONFLICT,
                "Last occurrence is more than " + schedulingProperties.getMaxHorizonDays() + " days ahead");
        }

        String tutorId = subscription.getTutorId();
        long version = sessionRepository.getScheduleVersion(tutorId);
        List<AvailabilityWindow> windows = windowRepository.findByTutorId(tutorId);
        List<Session> booked = sessionRepository.findBookedSessions(tutorId, rangeStart, rangeEnd, null);
        List<TimeBlock> blocks = timeBlockRepository.findOverlapping(tutorId, rangeStart, rangeEnd);

        SchedulingResult<SeriesRescheduleResult> plan = seriesRescheduler.rescheduleSeries(
            subscriptionId, scheduled, newAnchorDate, frequency, windows, booked, blocks, now);
        if (!plan.isSuccess()) {
            return reject("rescheduleSeries", plan.getRejection());
        }

        List<SessionScheduleUpdate> updates = plan.getValue().getUpdates();
        WriteOutcome outcome = sessionRepository.updateSeriesSchedule(tutorId, updates, version);
        if (outcome == WriteOutcome.CONFLICT) {
            return rejectConcurrent("rescheduleSeries", tutorId);
        }

        Map<String, Long> newTimes = updates.stream()
            .collect(Collectors.toMap(SessionScheduleUpdate::getSessionId, SessionScheduleUpdate::getNewScheduledAt));
        scheduled.forEach(session -> session.setScheduledAt(newTimes.get(session.getSessionId())));

        bookingMetrics.recordSuccess("rescheduleSeries");
        logger.info("Moved {} sessions of series {} to start {}", scheduled.size(), subscriptionId, newAnchorDate);
        return SchedulingResult.success(toDTOs(scheduled));
    }

    @Override
    public SchedulingResult<SessionDTO> cancelSession(String sessionId, String reason, String parentId) {
        logger.info("Parent {} cancelling session {}", parentId, sessionId);

        Session session = requireOwnedSession(sessionId, parentId);
        if (!session.isScheduled()) {
            return reject("cancelSession", SchedulingRejection.Reason.INVALID_STATE,
                "Session is " + session.getStatus() + " and can no longer be cancelled");
        }

        long now = clock.millis();
        if (!modificationPolicyGuard.canModify(session.getScheduledAt(), now)) {
            return reject("cancelSession", tooLate(session, now));
        }

        String notes = cancellationNote(reason);
        WriteOutcome outcome = sessionRepository.updateSessionStatus(sessionId, SessionStatus.CANCELLED, notes);
        if (outcome == WriteOutcome.CONFLICT) {
            return rejectConcurrent("cancelSession", session.getTutorId());
        }

        session.transitionTo(SessionStatus.CANCELLED);
        session.setNotes(notes);
        bookingMetrics.recordSuccess("cancelSession");
        return SchedulingResult.success(new SessionDTO(session));
    }

    @Override
    public SchedulingResult<List<SessionDTO>> cancelSeries(String subscriptionId, String reason, String parentId) {
        logger.info("Parent {} cancelling series {}", parentId, subscriptionId);

        Subscription subscription = requireOwnedSubscription(subscriptionId, parentId);
        List<Session> scheduled = findScheduledSessions(subscriptionId);
        if (scheduled.isEmpty()) {
            return reject("cancelSeries", SchedulingRejection.Reason.INVALID_STATE,
                "Series has no scheduled sessions to cancel");
        }
        if (scheduled.size() > SessionRepository.MAX_SESSIONS_PER_WRITE) {
            return reject("cancelSeries", SchedulingRejection.Reason.SERIES_CONFLICT,
                "Series has more than " + SessionRepository.MAX_SESSIONS_PER_WRITE + " sessions to cancel");
        }

        long now = clock.millis();
        Optional<Session> blocking = modificationPolicyGuard.findFirstBlocking(scheduled, now,
            modificationPolicyGuard.getMinNoticeHours());
        if (blocking.isPresent()) {
            return reject("cancelSeries", tooLate(blocking.get(), now));
        }

        String notes = cancellationNote(reason);
        List<String> sessionIds = scheduled.stream().map(Session::getSessionId).collect(Collectors.toList());
        WriteOutcome outcome = sessionRepository.cancelSessions(sessionIds, notes);
        if (outcome == WriteOutcome.CONFLICT) {
            return rejectConcurrent("cancelSeries", subscription.getTutorId());
        }

        scheduled.forEach(session -> {
            session.transitionTo(SessionStatus.CANCELLED);
            session.setNotes(notes);
        });
        bookingMetrics.recordSuccess("cancelSeries");
        logger.info("Cancelled {} sessions of series {}", scheduled.size(), subscriptionId);
        return SchedulingResult.success(toDTOs(scheduled));
    }

    @Override
    public SchedulingResult<SessionDTO> updateSessionStatus(String sessionId, SessionStatus status, String tutorId) {
        logger.info("Tutor {} marking session {} as {}", tutorId, sessionId, status);

        Session session = sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!session.getTutorId().equals(tutorId)) {
            throw new UnauthorizedException("Only the session's tutor can record its outcome");
        }
        if (status != SessionStatus.COMPLETED && status != SessionStatus.NO_SHOW) {
            return reject("updateSessionStatus", SchedulingRejection.Reason.INVALID_STATE,
                "Tutors can only mark sessions COMPLETED or NO_SHOW");
        }
        if (!session.getStatus().canTransitionTo(status)) {
            return reject("updateSessionStatus", SchedulingRejection.Reason.INVALID_STATE,
                "Session is already " + session.getStatus());
        }
        if (session.getScheduledAt() > clock.millis()) {
            return reject("updateSessionStatus", SchedulingRejection.Reason.INVALID_STATE,
                "Session has not started yet");
        }

        WriteOutcome outcome = sessionRepository.updateSessionStatus(sessionId, status, null);
        if (outcome == WriteOutcome.CONFLICT) {
            return rejectConcurrent("updateSessionStatus", tutorId);
        }

        session.transitionTo(status);
        bookingMetrics.recordSuccess("updateSessionStatus");
        return SchedulingResult.success(new SessionDTO(session));
    }

    @Override
    public AvailableSlotsDTO getAvailableSlots(String tutorId, long horizonStart, long horizonEnd, int durationMinutes) {
        if (horizonEnd <= horizonStart) {
            throw new ValidationException("Horizon end must be after horizon start");
        }
        if (durationMinutes <= 0) {
            throw new ValidationException("Duration must be positive");
        }

        long now = clock.millis();
        // Nothing before now is bookable, so past dates are never read or walked
        long from = Math.max(horizonStart, now);
        long cappedEnd = Math.min(horizonEnd, now + schedulingProperties.getMaxHorizonDays() * MILLIS_PER_DAY);
        if (cappedEnd <= from) {
            return new AvailableSlotsDTO(tutorId, from, from, durationMinutes, List.of());
        }

        List<AvailabilityWindow> windows = windowRepository.findByTutorId(tutorId);
        List<Session> booked = sessionRepository.findBookedSessions(tutorId, from,
            cappedEnd + durationMinutes * Interval.MILLIS_PER_MINUTE, null);
        List<TimeBlock> blocks = timeBlockRepository.findOverlapping(tutorId, from,
            cappedEnd + durationMinutes * Interval.MILLIS_PER_MINUTE);

        List<Long> slots = slotResolver.resolveSlots(windows, booked, blocks, from, cappedEnd,
            durationMinutes, now, null);

        logger.debug("Tutor {} has {} open {}-minute slots between {} and {}",
            tutorId, slots.size(), durationMinutes, from, cappedEnd);
        return new AvailableSlotsDTO(tutorId, from, cappedEnd, durationMinutes, slots);
    }

    @Override
    public SessionDTO getSession(String sessionId, String userId) {
        Session session = sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!userId.equals(session.getParentId()) && !userId.equals(session.getTutorId())) {
            throw new UnauthorizedException("Cannot view a session you are not part of");
        }
        return new SessionDTO(session);
    }

    @Override
    public List<SessionDTO> getSeries(String subscriptionId, String parentId) {
        requireOwnedSubscription(subscriptionId, parentId);
        return sessionRepository.findBySubscriptionId(subscriptionId).stream()
            .filter(Session::occupiesTime)
            .sorted(Comparator.comparing(Session::getScheduledAt))
            .map(SessionDTO::new)
            .collect(Collectors.toList());
    }

    @Override
    public List<ScheduleConflictDTO> findScheduleConflicts(String tutorId, long from, long to, String userId) {
        if (!tutorId.equals(userId)) {
            throw new UnauthorizedException("Only the tutor can check their schedule");
        }
        if (to <= from) {
            throw new ValidationException("Range end must be after range start");
        }

        List<ConflictDetector.Overlap> overlaps = conflictDetector.findOverlapping(
            sessionRepository.findBookedSessions(tutorId, from, to, null));
        if (!overlaps.isEmpty()) {
            logger.error("Tutor {} has {} overlapping session pairs between {} and {}",
                tutorId, overlaps.size(), from, to);
        }
        return overlaps.stream().map(ScheduleConflictDTO::new).collect(Collectors.toList());
    }

    private Optional<SchedulingRejection> validateSlot(String tutorId, long start, int durationMinutes,
                                                       String excludeSessionId, long now) {
        if (beyondHorizon(start, now)) {
            return Optional.of(SchedulingRejection.of(SchedulingRejection.Reason.SLOT_UNAVAILABLE,
                "Sessions can be booked at most " + schedulingProperties.getMaxHorizonDays() + " days ahead"));
        }

        Interval requested = Interval.ofMinutes(start, durationMinutes);
        List<AvailabilityWindow> windows = windowRepository.findByTutorId(tutorId);
        List<Session> booked = sessionRepository.findBookedSessions(tutorId, requested.getStart(),
            requested.getEnd(), excludeSessionId);
        List<TimeBlock> blocks = timeBlockRepository.findOverlapping(tutorId, requested.getStart(), requested.getEnd());

        SlotResolver.SlotVerdict verdict = slotResolver.checkSlot(windows, booked, blocks, start, durationMinutes,
            now, excludeSessionId);
        if (verdict == SlotResolver.SlotVerdict.BOOKABLE) {
            return Optional.empty();
        }
        return Optional.of(SchedulingRejection.of(SchedulingRejection.Reason.SLOT_UNAVAILABLE,
            "Requested time is not available (" + verdict.describe() + ")"));
    }

    private SchedulingResult<SessionDTO> commitNewSession(String operation, Session session, long version) {
        WriteOutcome outcome = sessionRepository.insertSession(session, version);
        if (outcome == WriteOutcome.CONFLICT) {
            return rejectConcurrent(operation, session.getTutorId());
        }
        bookingMetrics.recordSuccess(operation);
        logger.info("Booked session {} with tutor {} at {}",
            session.getSessionId(), session.getTutorId(), session.getScheduledAt());
        return SchedulingResult.success(new SessionDTO(session));
    }

    private boolean beyondHorizon(long start, long now) {
        return start > now + schedulingProperties.getMaxHorizonDays() * MILLIS_PER_DAY;
    }

    private SchedulingRejection tooLate(Session session, long now) {
        return SchedulingRejection.of(SchedulingRejection.Reason.MODIFICATION_NOT_ALLOWED,
            String.format("Sessions can only be changed at least %d hours in advance; session %s starts in %d hours",
                modificationPolicyGuard.getMinNoticeHours(), session.getSessionId(),
                modificationPolicyGuard.hoursUntil(session.getScheduledAt(), now)));
    }

    private List<Session> findScheduledSessions(String subscriptionId) {
        return sessionRepository.findBySubscriptionId(subscriptionId).stream()
            .filter(Session::isScheduled)
            .sorted(Comparator.comparing(Session::getScheduledAt))
            .collect(Collectors.toList());
    }

    private Session requireOwnedSession(String sessionId, String parentId) {
        Session session = sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!session.getParentId().equals(parentId)) {
            throw new UnauthorizedException("Session does not belong to this parent");
        }
        return session;
    }

    private Subscription requireOwnedSubscription(String subscriptionId, String parentId) {
        Subscription subscription = subscriptionRepository.findById(subscriptionId)
            .orElseThrow(() -> new ResourceNotFoundException("Subscription not found: " + subscriptionId));
        if (!subscription.getParentId().equals(parentId)) {
            throw new UnauthorizedException("Subscription does not belong to this parent");
        }
        return subscription;
    }

    static String cancellationNote(String reason) {
        if (reason == null || reason.trim().isEmpty()) {
            return CANCELED_BY_PARENT;
        }
        return "Canceled: " + reason.trim();
    }

    private static List<SessionDTO> toDTOs(List<Session> sessions) {
        return sessions.stream().map(SessionDTO::new).collect(Collectors.toList());
    }

    private <T> SchedulingResult<T> rejectConcurrent(String operation, String tutorId) {
        return reject(operation, SchedulingRejection.Reason.CONCURRENT_BOOKING_CONFLICT,
            "Tutor " + tutorId + "'s schedule changed while this request was processed; please try again");
    }

    private <T> SchedulingResult<T> reject(String operation, SchedulingRejection.Reason reason, String message) {
        return reject(operation, SchedulingRejection.of(reason, message));
    }

    private <T> SchedulingResult<T> reject(String operation, SchedulingRejection rejection) {
        logger.warn("{} rejected: {}", operation, rejection);
        bookingMetrics.recordRejection(operation, rejection.getReason());
        return SchedulingResult.rejected(rejection);
    }
}
