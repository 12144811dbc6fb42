package com.bbthechange.tutoring.service;

import com.bbthechange.tutoring.config.SchedulingProperties;
import com.bbthechange.tutoring.model.AvailabilityWindow;
import com.bbthechange.tutoring.model.Session;
import com.bbthechange.tutoring.model.SessionStatus;
import com.bbthechange.tutoring.model.TimeBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import static com.bbthechange.tutoring.testutil.SessionTestBuilder.aSession;
import static com.bbthechange.tutoring.testutil.TestTimes.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotResolverTest {

    private SlotResolver slotResolver;
    private String tutorId;
    private List<AvailabilityWindow> mondayMorning;
    private long now;
    private long horizonStart;
    private long horizonEnd;

    @BeforeEach
    void setUp() {
        SchedulingProperties properties = new SchedulingProperties();
        slotResolver = new SlotResolver(new ConflictDetector(), properties);
        tutorId = UUID.randomUUID().toString();
        mondayMorning = List.of(new AvailabilityWindow(tutorId, MONDAY_INDEX, "09:00", "11:00"));
        now = at(SUNDAY, 0, 0);
        horizonStart = at(MONDAY, 0, 0);
        horizonEnd = at(TUESDAY, 0, 0);
    }

    private Session booked(int hour, int minute, int minutes) {
        return aSession().withTutor(tutorId).at(at(MONDAY, hour, minute)).lasting(minutes).build();
    }

    @Nested
    @DisplayName("resolveSlots")
    class ResolveSlots {

        @Test
        void emptyScheduleYieldsEveryStepThatFitsInTheWindow() {
            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(), List.of(),
                horizonStart, horizonEnd, 60, 30, now, null);

            assertThat(slots).containsExactly(at(MONDAY, 9, 0), at(MONDAY, 9, 30), at(MONDAY, 10, 0));
        }

        @Test
        void bookingInTheMiddleOfTheWindowRemovesEveryOverlappingStart() {
            // Given - 09:30-10:30 is taken; 10:00-11:00 overlaps it as well
            List<Session> booked = List.of(booked(9, 30, 60));

            List<Long> slots = slotResolver.resolveSlots(mondayMorning, booked, List.of(),
                horizonStart, horizonEnd, 60, 30, now, null);

            assertThat(slots).isEmpty();
        }

        @Test
        void backToBackBookingLeavesTheFollowingSlotOpen() {
            List<Session> booked = List.of(booked(9, 0, 60));

            List<Long> slots = slotResolver.resolveSlots(mondayMorning, booked, List.of(),
                horizonStart, horizonEnd, 60, 30, now, null);

            assertThat(slots).containsExactly(at(MONDAY, 10, 0));
        }

        @Test
        void cancelledSessionsDoNotBlockSlots() {
            Session cancelled = aSession().withTutor(tutorId).at(at(MONDAY, 9, 30))
                .withStatus(SessionStatus.CANCELLED).build();

            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(cancelled), List.of(),
                horizonStart, horizonEnd, 60, 30, now, null);

            assertThat(slots).hasSize(3);
        }

        @Test
        void completedAndNoShowSessionsStillOccupyTime() {
            Session completed = aSession().withTutor(tutorId).at(at(MONDAY, 9, 0))
                .withStatus(SessionStatus.COMPLETED).build();
            Session noShow = aSession().withTutor(tutorId).at(at(MONDAY, 10, 0))
                .withStatus(SessionStatus.NO_SHOW).build();

            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(completed, noShow), List.of(),
                horizonStart, horizonEnd, 60, 30, now, null);

            assertThat(slots).isEmpty();
        }

        @Test
        void excludedSessionIsIgnored() {
            Session moving = booked(9, 30, 60);

            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(moving), List.of(),
                horizonStart, horizonEnd, 60, 30, now, moving.getSessionId());

            assertThat(slots).hasSize(3);
        }

        @Test
        void overlappingWindowsProduceEachStartOnce() {
            List<AvailabilityWindow> windows = List.of(
                new AvailabilityWindow(tutorId, MONDAY_INDEX, "09:00", "11:00"),
                new AvailabilityWindow(tutorId, MONDAY_INDEX, "10:00", "12:00"));

            List<Long> slots = slotResolver.resolveSlots(windows, List.of(), List.of(),
                horizonStart, horizonEnd, 60, 30, now, null);

            assertThat(slots).containsExactly(at(MONDAY, 9, 0), at(MONDAY, 9, 30), at(MONDAY, 10, 0),
                at(MONDAY, 10, 30), at(MONDAY, 11, 0));
        }

        @Test
        void inactiveWindowsAreSkipped() {
            AvailabilityWindow inactive = new AvailabilityWindow(tutorId, MONDAY_INDEX, "09:00", "11:00");
            inactive.setActive(false);

            List<Long> slots = slotResolver.resolveSlots(List.of(inactive), List.of(), List.of(),
                horizonStart, horizonEnd, 60, 30, now, null);

            assertThat(slots).isEmpty();
        }

        @Test
        void timeBlockRemovesOverlappingSlots() {
            TimeBlock dentist = new TimeBlock(tutorId, at(MONDAY, 10, 30), at(MONDAY, 10, 45), "Dentist");

            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(), List.of(dentist),
                horizonStart, horizonEnd, 60, 30, now, null);

            assertThat(slots).containsExactly(at(MONDAY, 9, 0), at(MONDAY, 9, 30));
        }

        @Test
        void slotsAtOrBeforeNowAreNotReturned() {
            long nowMidWindow = at(MONDAY, 9, 30);

            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(), List.of(),
                horizonStart, horizonEnd, 60, 30, nowMidWindow, null);

            assertThat(slots).containsExactly(at(MONDAY, 10, 0));
        }

        @Test
        void slotsAreLimitedToTheHorizon() {
            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(), List.of(),
                at(MONDAY, 9, 15), at(MONDAY, 10, 0), 60, 30, now, null);

            assertThat(slots).containsExactly(at(MONDAY, 9, 30));
        }

        @Test
        void horizonIncludesItsStartAndExcludesItsEnd() {
            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(), List.of(),
                at(MONDAY, 9, 0), at(MONDAY, 9, 30), 60, 30, now, null);

            assertThat(slots).containsExactly(at(MONDAY, 9, 0));
        }

        @Test
        void slotLongerThanWindowYieldsNothing() {
            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(), List.of(),
                horizonStart, horizonEnd, 180, 30, now, null);

            assertThat(slots).isEmpty();
        }

        @Test
        void weeklyWindowRepeatsEveryWeekInTheHorizon() {
            List<Long> slots = slotResolver.resolveSlots(mondayMorning, List.of(), List.of(),
                horizonStart, at(MONDAY.plusDays(8), 0, 0), 120, 30, now, null);

            assertThat(slots).containsExactly(at(MONDAY, 9, 0), at(MONDAY.plusDays(7), 9, 0));
        }

        @Test
        void everyReturnedSlotIsBookable() {
            List<Session> booked = List.of(booked(10, 0, 30));
            TimeBlock block = new TimeBlock(tutorId, at(MONDAY, 9, 0), at(MONDAY, 9, 15), null);

            List<Long> slots = slotResolver.resolveSlots(mondayMorning, booked, List.of(block),
                horizonStart, horizonEnd, 30, 15, now, null);

            assertThat(slots).isNotEmpty();
            assertThat(slots).allSatisfy(start -> assertThat(
                slotResolver.isBookable(mondayMorning, booked, List.of(block), start, 30, now, null)).isTrue());
        }

        @Test
        void nonPositiveDurationIsRejected() {
            assertThatThrownBy(() -> slotResolver.resolveSlots(mondayMorning, List.of(), List.of(),
                horizonStart, horizonEnd, 0, 30, now, null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("checkSlot")
    class CheckSlot {

        @Test
        void freeSlotInsideWindowIsBookable() {
            assertThat(slotResolver.checkSlot(mondayMorning, List.of(), List.of(), at(MONDAY, 9, 0), 60, now, null))
                .isEqualTo(SlotResolver.SlotVerdict.BOOKABLE);
        }

        @Test
        void slotInThePastIsReportedFirst() {
            assertThat(slotResolver.checkSlot(List.of(), List.of(), List.of(), now, 60, now, null))
                .isEqualTo(SlotResolver.SlotVerdict.IN_PAST);
        }

        @Test
        void slotRunningPastWindowEndIsOutsideAvailability() {
            assertThat(slotResolver.checkSlot(mondayMorning, List.of(), List.of(), at(MONDAY, 10, 30), 60, now, null))
                .isEqualTo(SlotResolver.SlotVerdict.OUTSIDE_AVAILABILITY);
        }

        @Test
        void slotOnAnotherWeekdayIsOutsideAvailability() {
            assertThat(slotResolver.checkSlot(mondayMorning, List.of(), List.of(), at(TUESDAY, 9, 0), 60, now, null))
                .isEqualTo(SlotResolver.SlotVerdict.OUTSIDE_AVAILABILITY);
        }

        @Test
        void overlappingBookingIsReported() {
            assertThat(slotResolver.checkSlot(mondayMorning, List.of(booked(9, 30, 60)), List.of(),
                at(MONDAY, 9, 0), 60, now, null))
                .isEqualTo(SlotResolver.SlotVerdict.OVERLAPS_SESSION);
        }

        @Test
        void timeBlockIsReported() {
            TimeBlock block = new TimeBlock(tutorId, at(MONDAY, 9, 0), at(MONDAY, 11, 0), "Holiday");

            assertThat(slotResolver.checkSlot(mondayMorning, List.of(), List.of(block), at(MONDAY, 9, 0), 60, now, null))
                .isEqualTo(SlotResolver.SlotVerdict.TIME_BLOCKED);
        }
    }

    @Nested
    @DisplayName("daylight saving")
    class DaylightSaving {

        private final ZoneId newYork = ZoneId.of("America/New_York");
        // Clocks in New York jump from 02:00 to 03:00 on this Sunday
        private final LocalDate springForward = LocalDate.of(2026, 3, 8);

        private SlotResolver newYorkResolver;
        private List<AvailabilityWindow> windows;

        @BeforeEach
        void setUp() {
            SchedulingProperties properties = new SchedulingProperties();
            properties.setZone(newYork);
            newYorkResolver = new SlotResolver(new ConflictDetector(), properties);
            windows = List.of(
                new AvailabilityWindow(tutorId, SUNDAY_INDEX, "02:00", "03:00"),
                new AvailabilityWindow(tutorId, MONDAY_INDEX, "09:00", "10:00"));
        }

        private long local(LocalDate date, int hour, int minute) {
            return LocalDateTime.of(date, LocalTime.of(hour, minute)).atZone(newYork).toInstant().toEpochMilli();
        }

        @Test
        void windowInsideTheSkippedHourOffersNothingThatDay() {
            List<Long> slots = newYorkResolver.resolveSlots(windows, List.of(), List.of(),
                local(springForward.minusDays(1), 0, 0), local(springForward.plusDays(2), 0, 0),
                60, 30, local(springForward.minusDays(2), 0, 0), null);

            assertThat(slots).containsExactly(local(springForward.plusDays(1), 9, 0));
        }

        @Test
        void windowInsideTheSkippedHourWorksOnOrdinarySundays() {
            LocalDate nextSunday = springForward.plusDays(7);

            List<Long> slots = newYorkResolver.resolveSlots(windows, List.of(), List.of(),
                local(nextSunday, 0, 0), local(nextSunday.plusDays(1), 0, 0),
                60, 30, local(springForward, 12, 0), null);

            assertThat(slots).containsExactly(local(nextSunday, 2, 0));
        }

        @Test
        void requestOnTheGapDayIsOutsideAvailability() {
            assertThat(newYorkResolver.checkSlot(windows, List.of(), List.of(),
                local(springForward, 3, 0), 30, local(springForward.minusDays(2), 0, 0), null))
                .isEqualTo(SlotResolver.SlotVerdict.OUTSIDE_AVAILABILITY);
        }
    }
}
