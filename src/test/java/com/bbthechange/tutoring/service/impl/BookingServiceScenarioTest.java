package com.bbthechange.tutoring.service.impl;

import com.bbthechange.tutoring.config.SchedulingProperties;
import com.bbthechange.tutoring.dto.BookRecurringRequest;
import com.bbthechange.tutoring.dto.BookSessionRequest;
import com.bbthechange.tutoring.dto.BookTrialRequest;
import com.bbthechange.tutoring.dto.SessionDTO;
import com.bbthechange.tutoring.model.AvailabilityWindow;
import com.bbthechange.tutoring.model.RecurrenceFrequency;
import com.bbthechange.tutoring.model.SchedulingRejection;
import com.bbthechange.tutoring.model.SchedulingResult;
import com.bbthechange.tutoring.model.Session;
import com.bbthechange.tutoring.model.SessionStatus;
import com.bbthechange.tutoring.model.Subscription;
import com.bbthechange.tutoring.service.ConflictDetector;
import com.bbthechange.tutoring.service.ModificationPolicyGuard;
import com.bbthechange.tutoring.service.SeriesRescheduler;
import com.bbthechange.tutoring.service.SlotResolver;
import com.bbthechange.tutoring.testutil.InMemoryAvailabilityStore;
import com.bbthechange.tutoring.testutil.InMemorySessionRepository;
import com.bbthechange.tutoring.util.BookingMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.bbthechange.tutoring.testutil.TestTimes.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end booking flows against in-memory repositories that enforce the
 * same optimistic version check as DynamoDB.
 */
class BookingServiceScenarioTest {

    private InMemorySessionRepository sessions;
    private InMemoryAvailabilityStore.Windows windows;
    private InMemoryAvailabilityStore.Subscriptions subscriptions;
    private InMemoryAvailabilityStore.Trials trials;
    private ConflictDetector conflictDetector;
    private BookingServiceImpl bookingService;

    private String tutorId;
    private long now;

    @BeforeEach
    void setUp() {
        SchedulingProperties properties = new SchedulingProperties();
        sessions = new InMemorySessionRepository();
        windows = new InMemoryAvailabilityStore.Windows();
        subscriptions = new InMemoryAvailabilityStore.Subscriptions();
        trials = new InMemoryAvailabilityStore.Trials();
        conflictDetector = new ConflictDetector();
        SlotResolver slotResolver = new SlotResolver(conflictDetector, properties);
        now = at(SUNDAY, 8, 0);

        bookingService = new BookingServiceImpl(sessions, windows, new InMemoryAvailabilityStore.Blocks(), subscriptions,
            new TrialEligibilityServiceImpl(trials, properties), slotResolver, conflictDetector,
            new ModificationPolicyGuard(properties), new SeriesRescheduler(slotResolver, properties),
            properties, new BookingMetrics(new SimpleMeterRegistry()), clockAt(now));

        tutorId = UUID.randomUUID().toString();
        windows.save(new AvailabilityWindow(tutorId, MONDAY_INDEX, "09:00", "11:00"));
        windows.save(new AvailabilityWindow(tutorId, TUESDAY_INDEX, "13:00", "17:00"));
    }

    private Subscription newSubscription() {
        Subscription subscription = new Subscription(tutorId, UUID.randomUUID().toString(), 10, 1);
        subscriptions.put(subscription);
        return subscription;
    }

    private SchedulingResult<SessionDTO> book(Subscription subscription, long start, int minutes) {
        return bookingService.bookSession(new BookSessionRequest(tutorId, subscription.getSubscriptionId(),
            start, minutes, null), subscription.getParentId());
    }

    private void assertNoOverlaps() {
        assertThat(conflictDetector.findOverlapping(sessions.findAll())).isEmpty();
    }

    @Test
    void rejectedSeriesRescheduleLeavesScheduleUntouched() {
        // Given - three weekly Tuesday 14:00 lessons
        Subscription series = newSubscription();
        SchedulingResult<List<SessionDTO>> booked = bookingService.bookRecurring(new BookRecurringRequest(tutorId,
            series.getSubscriptionId(), at(TUESDAY, 14, 0), 60, RecurrenceFrequency.WEEKLY, 3, "Ada"),
            series.getParentId());
        assertThat(booked.isSuccess()).isTrue();

        // and another family holds the slot the third moved lesson would need
        LocalDate anchor = TUESDAY.plusDays(14);
        assertThat(book(newSubscription(), at(anchor.plusDays(14), 14, 30), 30).isSuccess()).isTrue();
        List<String> before = sessions.snapshot();

        // When
        SchedulingResult<List<SessionDTO>> result = bookingService.rescheduleSeries(series.getSubscriptionId(),
            anchor, RecurrenceFrequency.WEEKLY, series.getParentId());

        // Then
        assertThat(result.getRejection().getReason()).isEqualTo(SchedulingRejection.Reason.SERIES_CONFLICT);
        assertThat(sessions.snapshot()).isEqualTo(before);
    }

    @Test
    void seriesRescheduleMovesEveryLesson() {
        Subscription series = newSubscription();
        bookingService.bookRecurring(new BookRecurringRequest(tutorId, series.getSubscriptionId(),
            at(TUESDAY, 14, 0), 60, RecurrenceFrequency.WEEKLY, 3, null), series.getParentId());
        LocalDate anchor = TUESDAY.plusDays(14);

        SchedulingResult<List<SessionDTO>> result = bookingService.rescheduleSeries(series.getSubscriptionId(),
            anchor, RecurrenceFrequency.WEEKLY, series.getParentId());

        assertThat(result.isSuccess()).isTrue();
        assertThat(sessions.findBySubscriptionId(series.getSubscriptionId()))
            .extracting(Session::getScheduledAt)
            .containsExactly(at(anchor, 14, 0), at(anchor.plusDays(7), 14, 0), at(anchor.plusDays(14), 14, 0));
        assertNoOverlaps();
    }

    @Test
    void recurringBookingIsAllOrNothing() {
        // Given - week three is taken
        assertThat(book(newSubscription(), at(TUESDAY.plusDays(14), 14, 0), 60).isSuccess()).isTrue();
        Subscription series = newSubscription();

        // When
        SchedulingResult<List<SessionDTO>> result = bookingService.bookRecurring(new BookRecurringRequest(tutorId,
            series.getSubscriptionId(), at(TUESDAY, 14, 0), 60, RecurrenceFrequency.WEEKLY, 4, null),
            series.getParentId());

        // Then
        assertThat(result.getRejection().getReason()).isEqualTo(SchedulingRejection.Reason.SERIES_CONFLICT);
        assertThat(sessions.findBySubscriptionId(series.getSubscriptionId())).isEmpty();
    }

    @Test
    void bookingCommittedBetweenReadAndWriteIsDetected() {
        Subscription first = newSubscription();
        Subscription second = newSubscription();
        AtomicReference<SchedulingResult<SessionDTO>> competitor = new AtomicReference<>();

        // Second family books the same slot while the first request is between its read and its write
        sessions.afterNextRead(() -> competitor.set(book(second, at(MONDAY, 9, 0), 60)));
        SchedulingResult<SessionDTO> result = book(first, at(MONDAY, 9, 0), 60);

        assertThat(competitor.get().isSuccess()).isTrue();
        assertThat(result.getRejection().getReason())
            .isEqualTo(SchedulingRejection.Reason.CONCURRENT_BOOKING_CONFLICT);
        assertThat(sessions.findAll()).hasSize(1);
    }

    @Test
    void parallelBookingsNeverOverlap() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SchedulingResult<SessionDTO>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Subscription subscription = newSubscription();
                long slot = at(MONDAY, 9, 0) + (i % 3) * 30 * 60_000L;
                Callable<SchedulingResult<SessionDTO>> attempt = () -> {
                    start.await();
                    return book(subscription, slot, 60);
                };
                futures.add(executor.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<SchedulingResult<SessionDTO>> future : futures) {
                SchedulingResult<SessionDTO> result = future.get(10, TimeUnit.SECONDS);
                if (result.isSuccess()) {
                    successes++;
                } else {
                    assertThat(result.getRejection().getReason()).isIn(
                        SchedulingRejection.Reason.SLOT_UNAVAILABLE,
                        SchedulingRejection.Reason.CONCURRENT_BOOKING_CONFLICT);
                }
            }
            assertThat(successes).isBetween(1, 2);
        } finally {
            executor.shutdownNow();
        }
        assertNoOverlaps();
    }

    @Test
    void scheduleStaysConsistentAcrossMixedOperations() {
        Subscription a = newSubscription();
        Subscription b = newSubscription();

        SessionDTO nine = book(a, at(MONDAY, 9, 0), 60).getValue();
        assertThat(book(b, at(MONDAY, 9, 30), 60).isSuccess()).isFalse();
        SessionDTO ten = book(b, at(MONDAY, 10, 0), 60).getValue();

        // Cancelling frees the slot for someone else
        assertThat(bookingService.cancelSession(nine.getSessionId(), "Sick", a.getParentId()).isSuccess()).isTrue();
        assertThat(bookingService.rescheduleSession(ten.getSessionId(), at(MONDAY, 9, 0), b.getParentId()).isSuccess())
            .isTrue();
        assertThat(book(a, at(MONDAY, 10, 0), 60).isSuccess()).isTrue();
        assertThat(bookingService.rescheduleSession(ten.getSessionId(), at(MONDAY, 9, 30), b.getParentId())
            .getRejection().getReason()).isEqualTo(SchedulingRejection.Reason.SLOT_UNAVAILABLE);

        assertNoOverlaps();
        assertThat(bookingService.findScheduleConflicts(tutorId, at(MONDAY, 0, 0), at(TUESDAY, 0, 0), tutorId))
            .isEmpty();
    }

    @Test
    void cancelHonoursMinimumNotice() {
        Subscription subscription = newSubscription();
        Session soon = new Session(tutorId, subscription.getParentId(), subscription.getSubscriptionId(), now + hours(10), 60);
        Session later = new Session(tutorId, subscription.getParentId(), subscription.getSubscriptionId(), now + hours(13), 60);
        sessions.put(soon);
        sessions.put(later);

        assertThat(bookingService.cancelSession(soon.getSessionId(), null, subscription.getParentId())
            .getRejection().getReason()).isEqualTo(SchedulingRejection.Reason.MODIFICATION_NOT_ALLOWED);
        assertThat(bookingService.cancelSession(later.getSessionId(), null, subscription.getParentId()).isSuccess())
            .isTrue();
        assertThat(sessions.findById(soon.getSessionId())).get()
            .extracting(Session::getStatus).isEqualTo(SessionStatus.SCHEDULED);
        assertThat(sessions.findById(later.getSessionId())).get()
            .extracting(Session::getStatus).isEqualTo(SessionStatus.CANCELLED);
    }

    @Test
    void trialCapIsEnforcedAcrossBookings() {
        String parentId = UUID.randomUUID().toString();

        assertThat(bookingService.bookTrial(new BookTrialRequest(tutorId, "math", null, at(MONDAY, 9, 0), null), parentId)
            .isSuccess()).isTrue();
        assertThat(bookingService.bookTrial(new BookTrialRequest(tutorId, "physics", null, at(MONDAY, 10, 0), null), parentId)
            .isSuccess()).isTrue();
        SchedulingResult<SessionDTO> third = bookingService.bookTrial(
            new BookTrialRequest(tutorId, null, null, at(TUESDAY, 13, 0), null), parentId);

        assertThat(third.getRejection().getReason()).isEqualTo(SchedulingRejection.Reason.TRIAL_LIMIT_REACHED);
        assertThat(trials.getTrialUsage(parentId).getTrialsUsed()).isEqualTo(2);
        assertThat(sessions.findAll()).hasSize(2);
    }

    @Test
    void trialsBookedTogetherWithDifferentTutorsStayWithinCap() {
        // Given - one trial left and a second tutor with Monday morning availability
        String parentId = UUID.randomUUID().toString();
        trials.setUsed(parentId, 1);
        String otherTutorId = UUID.randomUUID().toString();
        windows.save(new AvailabilityWindow(otherTutorId, MONDAY_INDEX, "09:00", "11:00"));

        // the other trial passes eligibility, commits and is counted while this one sits before its write
        AtomicReference<SchedulingResult<SessionDTO>> other = new AtomicReference<>();
        sessions.afterNextRead(() -> other.set(bookingService.bookTrial(
            new BookTrialRequest(otherTutorId, "physics", null, at(MONDAY, 9, 0), null), parentId)));

        // When
        SchedulingResult<SessionDTO> late = bookingService.bookTrial(
            new BookTrialRequest(tutorId, "math", null, at(MONDAY, 9, 0), null), parentId);

        // Then
        assertThat(other.get().isSuccess()).isTrue();
        assertThat(late.getRejection().getReason()).isEqualTo(SchedulingRejection.Reason.TRIAL_LIMIT_REACHED);
        assertThat(trials.getTrialUsage(parentId).getTrialsUsed()).isEqualTo(2);
        assertThat(sessions.findAll()).filteredOn(Session::isScheduled)
            .extracting(Session::getTutorId).containsExactly(otherTutorId);
        assertThat(sessions.findAll()).filteredOn(session -> session.getTutorId().equals(tutorId))
            .singleElement().extracting(Session::getStatus).isEqualTo(SessionStatus.CANCELLED);
    }
}
