package com.bbthechange.tutoring.model;

import org.springframework.http.HttpStatus;

import java.util.Objects;

/**
 * Why the booking engine refused a request. Rejections are expected outcomes
 * and travel as values inside {@link SchedulingResult}; they are never thrown.
 */
public final class SchedulingRejection {

    public enum Reason {
        INVALID_WINDOW(HttpStatus.BAD_REQUEST),
        SLOT_UNAVAILABLE(HttpStatus.CONFLICT),
        MODIFICATION_NOT_ALLOWED(HttpStatus.UNPROCESSABLE_ENTITY),
        SERIES_CONFLICT(HttpStatus.CONFLICT),
        TRIAL_LIMIT_REACHED(HttpStatus.UNPROCESSABLE_ENTITY),
        CONCURRENT_BOOKING_CONFLICT(HttpStatus.CONFLICT),
        INVALID_STATE(HttpStatus.UNPROCESSABLE_ENTITY);

        private final HttpStatus httpStatus;

        Reason(HttpStatus httpStatus) {
            this.httpStatus = httpStatus;
        }

        public HttpStatus httpStatus() {
            return httpStatus;
        }
    }

    private final Reason reason;
    private final String message;

    private SchedulingRejection(Reason reason, String message) {
        this.reason = Objects.requireNonNull(reason, "reason");
        this.message = message;
    }

    public static SchedulingRejection of(Reason reason, String message) {
        return new SchedulingRejection(reason, message);
    }

    public Reason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SchedulingRejection that = (SchedulingRejection) o;
        return reason == that.reason && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason, message);
    }

    @Override
    public String toString() {
        return reason + ": " + message;
    }
}
