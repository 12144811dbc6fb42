package com.bbthechange.tutoring.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times every call the repositories make against TutoringTable.
 * Slow calls are logged at WARN; every call lands in the
 * {@code tutoring.store.duration} timer tagged by operation and outcome.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);

    private final MeterRegistry meterRegistry;
    private final long slowQueryThresholdMs;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry,
                                   @Value("${tutoring.store.slow-query-threshold-ms:500}") long slowQueryThresholdMs) {
        this.meterRegistry = meterRegistry;
        this.slowQueryThresholdMs = slowQueryThresholdMs;
    }

    /**
     * Run a store operation and record how long it took.
     *
     * @param operation logical operation name, e.g. "insertSession"
     * @param index table or index the operation touches
     * @param storeOperation the call to execute
     * @return whatever the operation returns
     */
    public <T> T trackQuery(String operation, String index, Supplier<T> storeOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = storeOperation.get();
            long duration = System.currentTimeMillis() - startTime;

            if (duration > slowQueryThresholdMs) {
                logger.warn("Slow store call: operation={}, index={}, duration={}ms",
                    operation, index, duration);
            } else {
                logger.debug("Store call completed: operation={}, index={}, duration={}ms",
                    operation, index, duration);
            }
            return result;

        } catch (RuntimeException e) {
            outcome = "error";
            logger.error("Store call failed: operation={}, index={}, duration={}ms, error={}",
                operation, index, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;

        } finally {
            sample.stop(Timer.builder("tutoring.store.duration")
                .tag("operation", operation)
                .tag("index", index)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }
}
