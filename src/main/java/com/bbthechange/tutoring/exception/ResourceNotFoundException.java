package com.bbthechange.tutoring.exception;

/**
 * Thrown when a referenced subscription, window or time block does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
