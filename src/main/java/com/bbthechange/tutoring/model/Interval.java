package com.bbthechange.tutoring.model;

import java.util.Objects;

/**
 * Half-open time interval [start, end) in epoch milliseconds.
 */
public final class Interval {

    public static final long MILLIS_PER_MINUTE = 60_000L;

    private final long start;
    private final long end;

    private Interval(long start, long end) {
        if (end <= start) {
            throw new IllegalArgumentException("Interval end must be after start: [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public static Interval of(long start, long end) {
        return new Interval(start, end);
    }

    public static Interval ofMinutes(long start, int durationMinutes) {
        return new Interval(start, start + durationMinutes * MILLIS_PER_MINUTE);
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    /**
     * Strict on both sides, so back-to-back intervals do not overlap.
     */
    public boolean overlaps(Interval other) {
        return start < other.end && other.start < end;
    }

    public boolean contains(Interval other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval)) return false;
        Interval interval = (Interval) o;
        return start == interval.start && end == interval.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
