package com.bbthechange.tutoring.model;

/**
 * Spacing between consecutive sessions of a recurring series.
 */
public enum RecurrenceFrequency {
    WEEKLY(7),
    BIWEEKLY(14);

    private final int intervalDays;

    RecurrenceFrequency(int intervalDays) {
        this.intervalDays = intervalDays;
    }

    public int getIntervalDays() {
        return intervalDays;
    }
}
