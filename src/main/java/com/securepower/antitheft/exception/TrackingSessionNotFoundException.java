package com.securepower.antitheft.exception;

public class TrackingSessionNotFoundException extends RuntimeException {

    public TrackingSessionNotFoundException(String sessionId) {
        super("Tracking session not found: " + sessionId);
    }
}
