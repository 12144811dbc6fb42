package com.bbthechange.tutoring.service;

import com.bbthechange.tutoring.config.SchedulingProperties;
import com.bbthechange.tutoring.model.AvailabilityWindow;
import com.bbthechange.tutoring.model.Interval;
import com.bbthechange.tutoring.model.Session;
import com.bbthechange.tutoring.model.TimeBlock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns recurring weekly windows into concrete bookable start times.
 *
 * Windows are interpreted in the configured reference zone. A candidate slot
 * [start, start + duration) is bookable when it lies inside one active window
 * for its weekday, starts strictly after {@code now}, and overlaps neither a
 * time-occupying session nor a time block. Booking and rescheduling go through
 * {@link #checkSlot} so the same rule applies everywhere.
 */
@Component
public class SlotResolver {

    public enum SlotVerdict {
        BOOKABLE("bookable"),
        IN_PAST("in the past"),
        OUTSIDE_AVAILABILITY("outside the tutor's availability"),
        OVERLAPS_SESSION("overlaps another booking"),
        TIME_BLOCKED("tutor is unavailable");

        private final String description;

        SlotVerdict(String description) {
            this.description = description;
        }

        public String describe() {
            return description;
        }
    }

    private final ConflictDetector conflictDetector;
    private final SchedulingProperties schedulingProperties;

    @Autowired
    public SlotResolver(ConflictDetector conflictDetector, SchedulingProperties schedulingProperties) {
        this.conflictDetector = conflictDetector;
        this.schedulingProperties = schedulingProperties;
    }

    public List<Long> resolveSlots(List<AvailabilityWindow> windows, List<Session> booked, List<TimeBlock> timeBlocks,
                                   long horizonStart, long horizonEnd, int slotDurationMinutes,
                                   long now, String excludeSessionId) {
        return resolveSlots(windows, booked, timeBlocks, horizonStart, horizonEnd, slotDurationMinutes,
            schedulingProperties.getSlotStepMinutes(), now, excludeSessionId);
    }

    /**
     * Bookable slot starts in [horizonStart, horizonEnd), ascending and without duplicates.
     * Every start is also strictly after {@code now}; a slot may end after horizonEnd as long
     * as it fits in its window. Windows are expanded for each zone date from the date of
     * horizonStart through the date of horizonEnd. A window that is empty on a given date,
     * such as one inside a daylight saving gap, offers nothing that day. Overlapping windows
     * produce the same start only once. An empty list means no availability.
     *
     * @param excludeSessionId booked session to ignore, e.g. the one being rescheduled; may be null
     */
    public List<Long> resolveSlots(List<AvailabilityWindow> windows, List<Session> booked, List<TimeBlock> timeBlocks,
                                   long horizonStart, long horizonEnd, int slotDurationMinutes, int stepMinutes,
                                   long now, String excludeSessionId) {
        if (slotDurationMinutes <= 0 || stepMinutes <= 0) {
            throw new IllegalArgumentException("Slot duration and step must be positive");
        }
        if (horizonEnd <= horizonStart) {
            return List.of();
        }

        ZoneId zone = schedulingProperties.getZone();
        List<Interval> blocked = toIntervals(timeBlocks);
        long slotMillis = slotDurationMinutes * Interval.MILLIS_PER_MINUTE;
        long stepMillis = stepMinutes * Interval.MILLIS_PER_MINUTE;

        Set<Long> slots = new TreeSet<>();
        LocalDate lastDate = Instant.ofEpochMilli(horizonEnd).atZone(zone).toLocalDate();
        for (LocalDate date = Instant.ofEpochMilli(horizonStart).atZone(zone).toLocalDate();
             !date.isAfter(lastDate); date = date.plusDays(1)) {

            for (AvailabilityWindow window : windows) {
                if (!window.isActiveWindow() || !window.fallsOn(date)) {
                    continue;
                }
                Optional<Interval> resolved = windowInterval(window, date, zone);
                if (resolved.isEmpty()) {
                    continue;
                }
                Interval windowInterval = resolved.get();
                for (long cursor = windowInterval.getStart(); cursor + slotMillis <= windowInterval.getEnd(); cursor += stepMillis) {
                    if (cursor <= now || cursor < horizonStart || cursor >= horizonEnd) {
                        continue;
                    }
                    Interval candidate = Interval.of(cursor, cursor + slotMillis);
                    if (!conflictDetector.overlapsAnySession(candidate, booked, excludeSessionId)
                        && !conflictDetector.overlaps(candidate, blocked)) {
                        slots.add(cursor);
                    }
                }
            }
        }
        return new ArrayList<>(slots);
    }

    public boolean isBookable(List<AvailabilityWindow> windows, List<Session> booked, List<TimeBlock> timeBlocks,
                              long start, int durationMinutes, long now, String excludeSessionId) {
        return checkSlot(windows, booked, timeBlocks, start, durationMinutes, now, excludeSessionId) == SlotVerdict.BOOKABLE;
    }

    /**
     * Classify one requested slot. The first failing rule wins, in the order
     * past, availability, booked sessions, time blocks.
     */
    public SlotVerdict checkSlot(List<AvailabilityWindow> windows, List<Session> booked, List<TimeBlock> timeBlocks,
                                 long start, int durationMinutes, long now, String excludeSessionId) {
        if (start <= now) {
            return SlotVerdict.IN_PAST;
        }
        Interval candidate = Interval.ofMinutes(start, durationMinutes);
        if (!insideActiveWindow(windows, candidate)) {
            return SlotVerdict.OUTSIDE_AVAILABILITY;
        }
        if (conflictDetector.overlapsAnySession(candidate, booked, excludeSessionId)) {
            return SlotVerdict.OVERLAPS_SESSION;
        }
        if (conflictDetector.overlaps(candidate, toIntervals(timeBlocks))) {
            return SlotVerdict.TIME_BLOCKED;
        }
        return SlotVerdict.BOOKABLE;
    }

    private boolean insideActiveWindow(List<AvailabilityWindow> windows, Interval candidate) {
        ZoneId zone = schedulingProperties.getZone();
        LocalDate date = Instant.ofEpochMilli(candidate.getStart()).atZone(zone).toLocalDate();
        return windows.stream()
            .filter(AvailabilityWindow::isActiveWindow)
            .filter(window -> window.fallsOn(date))
            .map(window -> windowInterval(window, date, zone))
            .anyMatch(interval -> interval.isPresent() && interval.get().contains(candidate));
    }

    /**
     * The window's span on {@code date}, or empty when the zone's clock change
     * leaves nothing between its start and end times.
     */
    private static Optional<Interval> windowInterval(AvailabilityWindow window, LocalDate date, ZoneId zone) {
        long start = toEpochMilli(date, window.getStartLocalTime(), zone);
        long end = toEpochMilli(date, window.getEndLocalTime(), zone);
        if (end <= start) {
            return Optional.empty();
        }
        return Optional.of(Interval.of(start, end));
    }

    private static long toEpochMilli(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone).toInstant().toEpochMilli();
    }

    private static List<Interval> toIntervals(Collection<TimeBlock> timeBlocks) {
        return timeBlocks.stream().map(TimeBlock::getInterval).collect(Collectors.toList());
    }
}
