package com.bbthechange.tutoring.exception;

/**
 * Malformed request input: missing ids, non-positive durations, inverted ranges.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
