package com.bbthechange.tutoring.service;

import com.bbthechange.tutoring.config.SchedulingProperties;
import com.bbthechange.tutoring.model.AvailabilityWindow;
import com.bbthechange.tutoring.model.RecurrenceFrequency;
import com.bbthechange.tutoring.model.SchedulingRejection;
import com.bbthechange.tutoring.model.SchedulingResult;
import com.bbthechange.tutoring.model.SeriesRescheduleResult;
import com.bbthechange.tutoring.model.Session;
import com.bbthechange.tutoring.model.SessionScheduleUpdate;
import com.bbthechange.tutoring.model.TimeBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recomputes the dates of a whole series from a new anchor date.
 *
 * Occurrence k of the series moves to {@code newAnchorDate + k * intervalDays},
 * keeping its own time of day and duration. Every regenerated slot is checked
 * with {@link SlotResolver#checkSlot} against the tutor's other bookings (the
 * series' own sessions do not count), time blocks and current active windows.
 * One failing occurrence rejects the whole series.
 */
@Component
public class SeriesRescheduler {

    private static final Logger logger = LoggerFactory.getLogger(SeriesRescheduler.class);

    private final SlotResolver slotResolver;
    private final SchedulingProperties schedulingProperties;

    @Autowired
    public SeriesRescheduler(SlotResolver slotResolver, SchedulingProperties schedulingProperties) {
        this.slotResolver = slotResolver;
        this.schedulingProperties = schedulingProperties;
    }

    /**
     * @param currentSessions the SCHEDULED sessions of the series; sorted here by scheduledAt
     * @param otherBooked booked sessions of the tutor around the new dates; series members are ignored
     */
    public SchedulingResult<SeriesRescheduleResult> rescheduleSeries(String subscriptionId,
                                                                     List<Session> currentSessions,
                                                                     LocalDate newAnchorDate,
                                                                     RecurrenceFrequency frequency,
                                                                     List<AvailabilityWindow> windows,
                                                                     List<Session> otherBooked,
                                                                     List<TimeBlock> timeBlocks,
                                                                     long now) {
        ZoneId zone = schedulingProperties.getZone();
        List<Session> series = currentSessions.stream()
            .sorted(Comparator.comparing(Session::getScheduledAt))
            .collect(Collectors.toList());

        Set<String> seriesIds = series.stream().map(Session::getSessionId).collect(Collectors.toSet());
        List<Session> others = otherBooked.stream()
            .filter(session -> !seriesIds.contains(session.getSessionId()))
            .collect(Collectors.toList());

        List<SessionScheduleUpdate> updates = new ArrayList<>();
        for (int k = 0; k < series.size(); k++) {
            Session session = series.get(k);
            LocalTime timeOfDay = Instant.ofEpochMilli(session.getScheduledAt()).atZone(zone).toLocalTime();
            LocalDate newDate = newAnchorDate.plusDays((long) k * frequency.getIntervalDays());
            long newStart = ZonedDateTime.of(newDate, timeOfDay, zone).toInstant().toEpochMilli();

            SlotResolver.SlotVerdict verdict = slotResolver.checkSlot(
                windows, others, timeBlocks, newStart, session.getDuration(), now, null);
            if (verdict != SlotResolver.SlotVerdict.BOOKABLE) {
                String message = String.format("Occurrence %d of %d on %s at %s is not available (%s)",
                    k + 1, series.size(), newDate, timeOfDay, verdict.describe());
                logger.warn("Series {} cannot move to anchor {}: {}", subscriptionId, newAnchorDate, message);
                return SchedulingResult.rejected(SchedulingRejection.Reason.SERIES_CONFLICT, message);
            }
            updates.add(new SessionScheduleUpdate(session.getSessionId(), newStart));
        }

        logger.debug("Series {} regenerated {} occurrences from {}", subscriptionId, updates.size(), newAnchorDate);
        return SchedulingResult.success(new SeriesRescheduleResult(subscriptionId, updates));
    }
}
