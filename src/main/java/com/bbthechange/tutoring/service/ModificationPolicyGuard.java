package com.bbthechange.tutoring.service;

import com.bbthechange.tutoring.config.SchedulingProperties;
import com.bbthechange.tutoring.model.Session;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Minimum-notice rule for cancelling or rescheduling: a session may only be
 * changed while at least {@code minNoticeHours} remain before it starts.
 */
@Component
public class ModificationPolicyGuard {

    private static final long MILLIS_PER_HOUR = 3_600_000L;

    private final SchedulingProperties schedulingProperties;

    @Autowired
    public ModificationPolicyGuard(SchedulingProperties schedulingProperties) {
        this.schedulingProperties = schedulingProperties;
    }

    public boolean canModify(long scheduledAt, long now) {
        return canModify(scheduledAt, now, schedulingProperties.getMinNoticeHours());
    }

    public boolean canModify(long scheduledAt, long now, int minNoticeHours) {
        return scheduledAt - now >= minNoticeHours * MILLIS_PER_HOUR;
    }

    public boolean canModifySeries(Collection<Session> sessions, long now) {
        return canModifySeries(sessions, now, schedulingProperties.getMinNoticeHours());
    }

    /**
     * False if any SCHEDULED session of the series is inside the notice window.
     * Sessions in other states are ignored.
     */
    public boolean canModifySeries(Collection<Session> sessions, long now, int minNoticeHours) {
        return findFirstBlocking(sessions, now, minNoticeHours).isEmpty();
    }

    /**
     * The earliest SCHEDULED session that is too close to change, if any.
     */
    public Optional<Session> findFirstBlocking(Collection<Session> sessions, long now, int minNoticeHours) {
        return sessions.stream()
            .filter(Session::isScheduled)
            .filter(session -> !canModify(session.getScheduledAt(), now, minNoticeHours))
            .min(Comparator.comparing(Session::getScheduledAt));
    }

    public int getMinNoticeHours() {
        return schedulingProperties.getMinNoticeHours();
    }

    /**
     * Hours from now until the session starts, rounded down; negative once it started.
     */
    public long hoursUntil(long scheduledAt, long now) {
        return Math.floorDiv(scheduledAt - now, MILLIS_PER_HOUR);
    }
}
