package com.bbthechange.tutoring.util;

import com.bbthechange.tutoring.model.SchedulingRejection;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Counters for booking-engine outcomes, tagged by operation and result.
 */
@Component
public class BookingMetrics {

    private static final String OUTCOME_METRIC = "tutoring_booking_total";

    private final MeterRegistry meterRegistry;

    @Autowired
    public BookingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordSuccess(String operation) {
        meterRegistry.counter(OUTCOME_METRIC, "operation", operation, "status", "success").increment();
    }

    public void recordRejection(String operation, SchedulingRejection.Reason reason) {
        meterRegistry.counter(OUTCOME_METRIC, "operation", operation, "status", reason.name().toLowerCase()).increment();
    }
}
