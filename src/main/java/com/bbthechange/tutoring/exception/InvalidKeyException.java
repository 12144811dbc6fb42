package com.bbthechange.tutoring.exception;

/**
 * Thrown by TutoringKeyFactory when an id cannot be turned into a table key.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
