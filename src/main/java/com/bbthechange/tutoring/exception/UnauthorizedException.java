package com.bbthechange.tutoring.exception;

/**
 * Thrown when a parent acts on a session or series that belongs to someone else.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
