package com.bbthechange.tutoring.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a booking-engine operation: either a value or a typed rejection.
 *
 * @param <T> type of the success value
 */
public final class SchedulingResult<T> {

    private final T value;
    private final SchedulingRejection rejection;

    private SchedulingResult(T value, SchedulingRejection rejection) {
        this.value = value;
        this.rejection = rejection;
    }

    public static <T> SchedulingResult<T> success(T value) {
        return new SchedulingResult<>(value, null);
    }

    public static <T> SchedulingResult<T> rejected(SchedulingRejection rejection) {
        return new SchedulingResult<>(null, Objects.requireNonNull(rejection, "rejection"));
    }

    public static <T> SchedulingResult<T> rejected(SchedulingRejection.Reason reason, String message) {
        return rejected(SchedulingRejection.of(reason, message));
    }

    public boolean isSuccess() {
        return rejection == null;
    }

    /**
     * @throws IllegalStateException if this result is a rejection
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on rejected result: " + rejection);
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this result is a success
     */
    public SchedulingRejection getRejection() {
        if (isSuccess()) {
            throw new IllegalStateException("Result is not rejected");
        }
        return rejection;
    }

    public <R> SchedulingResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return rejected(rejection);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Rejected[" + rejection + "]";
    }
}
