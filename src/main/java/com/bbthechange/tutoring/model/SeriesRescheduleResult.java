package com.bbthechange.tutoring.model;

import java.util.List;

/**
 * Regenerated schedule for a series, one update per session in series order.
 */
public final class SeriesRescheduleResult {

    private final String subscriptionId;
    private final List<SessionScheduleUpdate> updates;

    public SeriesRescheduleResult(String subscriptionId, List<SessionScheduleUpdate> updates) {
        this.subscriptionId = subscriptionId;
        this.updates = List.copyOf(updates);
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public List<SessionScheduleUpdate> getUpdates() {
        return updates;
    }
}
