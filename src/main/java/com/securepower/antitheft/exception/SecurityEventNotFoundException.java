package com.securepower.antitheft.exception;

import java.util.UUID;

public class SecurityEventNotFoundException extends RuntimeException {

    public SecurityEventNotFoundException(UUID eventId) {
        super("Security event not found: " + eventId);
    }
}
