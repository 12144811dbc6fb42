package com.bbthechange.tutoring.exception;

public class SessionNotFoundException extends ResourceNotFoundException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
