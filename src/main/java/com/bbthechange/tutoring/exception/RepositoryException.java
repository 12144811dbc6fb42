package com.bbthechange.tutoring.exception;

/**
 * Store-layer failure (DynamoDB unreachable, throttled, malformed item).
 * Distinct from booking rejections, which are returned as values.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
