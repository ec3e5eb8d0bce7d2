package com.securepower.antitheft.exception;

import java.util.UUID;

/**
 * Exception thrown when a security event cannot be dispatched at all, e.g. because the
 * owning user or device record is missing. The event is left unprocessed with the error
 * attached; retrying is up to whoever delivered the trigger.
 */
public class UnrecoverableEventException extends RuntimeException {

    private final UUID eventId;

    public UnrecoverableEventException(UUID eventId, String message) {
        super(message);
        this.eventId = eventId;
    }

    public UUID getEventId() {
        return eventId;
    }
}
