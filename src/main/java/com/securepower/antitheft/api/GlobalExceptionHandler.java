package com.securepower.antitheft.api;

import com.securepower.antitheft.exception.CredentialAlreadyConfiguredException;
import com.securepower.antitheft.exception.DeviceLockedOutException;
import com.securepower.antitheft.exception.DeviceNotFoundException;
import com.securepower.antitheft.exception.InvalidCredentialFormatException;
import com.securepower.antitheft.exception.SecurityEventNotFoundException;
import com.securepower.antitheft.exception.TrackingSessionInactiveException;
import com.securepower.antitheft.exception.TrackingSessionNotFoundException;
import com.securepower.antitheft.exception.UnrecoverableEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to {"error", "message"} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidCredentialFormatException.class)
    public ResponseEntity<?> handleInvalidCredential(InvalidCredentialFormatException ex) {
        log.warn("Credential rejected: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid credential format", ex.getMessage());
    }

    @ExceptionHandler(DeviceLockedOutException.class)
    public ResponseEntity<?> handleLockedOut(DeviceLockedOutException ex) {
        log.warn("Credential change refused: {}", ex.getMessage());
        return error(HttpStatus.LOCKED, "Device locked out", ex.getMessage());
    }

    @ExceptionHandler(CredentialAlreadyConfiguredException.class)
    public ResponseEntity<?> handleAlreadyConfigured(CredentialAlreadyConfiguredException ex) {
        log.warn("Credential setup refused: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "Credentials already configured", ex.getMessage());
    }

    @ExceptionHandler({DeviceNotFoundException.class, TrackingSessionNotFoundException.class,
            SecurityEventNotFoundException.class})
    public ResponseEntity<?> handleNotFound(RuntimeException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "Not found", ex.getMessage());
    }

    @ExceptionHandler(TrackingSessionInactiveException.class)
    public ResponseEntity<?> handleInactiveSession(TrackingSessionInactiveException ex) {
        log.info("Rejected update for closed session {}", ex.getSessionId());
        return error(HttpStatus.CONFLICT, "Tracking session inactive", ex.getMessage());
    }

    @ExceptionHandler(UnrecoverableEventException.class)
    public ResponseEntity<?> handleUnrecoverable(UnrecoverableEventException ex) {
        log.error("Event {} cannot be processed: {}", ex.getEventId(), ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Event cannot be processed", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "Validation failed", message);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<?> handleBadRequest(RuntimeException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
    }

    private ResponseEntity<?> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of("error", error, "message", String.valueOf(message)));
    }
}
