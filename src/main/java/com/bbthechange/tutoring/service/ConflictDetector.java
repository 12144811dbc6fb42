package com.bbthechange.tutoring.service;

import com.bbthechange.tutoring.model.Interval;
import com.bbthechange.tutoring.model.Session;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Overlap checks between half-open intervals. Back-to-back intervals do not
 * overlap. Cancelled sessions never take part in a conflict.
 */
@Component
public class ConflictDetector {

    public boolean overlaps(Interval candidate, Collection<Interval> booked) {
        for (Interval interval : booked) {
            if (candidate.overlaps(interval)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param excludeSessionId session to ignore, typically the one being moved; may be null
     */
    public boolean overlapsAnySession(Interval candidate, Collection<Session> sessions, String excludeSessionId) {
        return sessions.stream()
            .filter(Session::occupiesTime)
            .filter(session -> !Objects.equals(session.getSessionId(), excludeSessionId))
            .anyMatch(session -> candidate.overlaps(session.getOccupiedInterval()));
    }

    /**
     * Every pair of time-occupying sessions whose intervals overlap.
     * An empty result means the set of sessions is conflict free.
     */
    public List<Overlap> findOverlapping(Collection<Session> sessions) {
        List<Session> sorted = sessions.stream()
            .filter(Session::occupiesTime)
            .sorted(Comparator.comparing(Session::getScheduledAt))
            .collect(Collectors.toList());

        List<Overlap> overlaps = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Interval current = sorted.get(i).getOccupiedInterval();
            for (int j = i + 1; j < sorted.size() && sorted.get(j).getScheduledAt() < current.getEnd(); j++) {
                overlaps.add(new Overlap(sorted.get(i), sorted.get(j)));
            }
        }
        return overlaps;
    }

    /**
     * Two sessions of the same tutor that occupy overlapping time.
     */
    public static final class Overlap {
        private final Session first;
        private final Session second;

        public Overlap(Session first, Session second) {
            this.first = first;
            this.second = second;
        }

        public Session getFirst() {
            return first;
        }

        public Session getSecond() {
            return second;
        }
    }
}
