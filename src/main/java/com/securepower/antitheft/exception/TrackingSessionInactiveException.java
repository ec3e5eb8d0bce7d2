package com.securepower.antitheft.exception;

/**
 * Exception thrown when a location is appended to a session that has already been closed.
 */
public class TrackingSessionInactiveException extends RuntimeException {

    private final String sessionId;

    public TrackingSessionInactiveException(String sessionId) {
        super("Tracking session is no longer active: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
