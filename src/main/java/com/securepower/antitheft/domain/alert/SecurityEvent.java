// ==============================================================================
// Security Event Domain Model
// File: src/main/java/com/securepower/antitheft/domain/alert/SecurityEvent.java
// ==============================================================================

package com.securepower.antitheft.domain.alert;

import com.securepower.antitheft.domain.tracking.LocationPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A security escalation raised for a device. The identifying fields are fixed at creation;
 * only the session link, the channel outcomes and the processing flag change afterwards.
 */
public class SecurityEvent {
    private final UUID eventId;
    private final String deviceId;
    private final String userId;
    private final AlertType type;
    private final Instant timestamp;
    private final Map<String, String> details;
    private final LocationPoint location;

    private String sessionId;
    private boolean processed;
    private Instant processedAt;
    private String processingError;
    private final List<NotificationOutcome> outcomes;

    public SecurityEvent(UUID eventId, String deviceId, String userId, AlertType type, Instant timestamp,
                         Map<String, String> details, LocationPoint location, String sessionId,
                         boolean processed, Instant processedAt, String processingError,
                         List<NotificationOutcome> outcomes) {
        this.eventId = eventId;
        this.deviceId = deviceId;
        this.userId = userId;
        this.type = type;
        this.timestamp = timestamp;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
        this.location = location;
        this.sessionId = sessionId;
        this.processed = processed;
        this.processedAt = processedAt;
        this.processingError = processingError;
        this.outcomes = outcomes != null ? new ArrayList<>(outcomes) : new ArrayList<>();
    }

    public static SecurityEvent raise(String deviceId, String userId, AlertType type, Instant timestamp,
                                      Map<String, String> details, LocationPoint location) {
        return new SecurityEvent(UUID.randomUUID(), deviceId, userId, type, timestamp, details, location,
                null, false, null, null, List.of());
    }

    // Getters
    public UUID getEventId() { return eventId; }
    public String getDeviceId() { return deviceId; }
    public String getUserId() { return userId; }
    public AlertType getType() { return type; }
    public Instant getTimestamp() { return timestamp; }
    public Map<String, String> getDetails() { return details; }
    public Optional<LocationPoint> getLocation() { return Optional.ofNullable(location); }
    public Optional<String> getSessionId() { return Optional.ofNullable(sessionId); }
    public boolean isProcessed() { return processed; }
    public Instant getProcessedAt() { return processedAt; }
    public String getProcessingError() { return processingError; }
    public List<NotificationOutcome> getOutcomes() { return Collections.unmodifiableList(outcomes); }

    /**
     * @throws IllegalArgumentException when an identifier needed for dispatch is missing
     */
    public void requireIdentifiers() {
        if (eventId == null || deviceId == null || deviceId.isBlank() || type == null || timestamp == null) {
            throw new IllegalArgumentException("Malformed security event: eventId, deviceId, type and timestamp are required");
        }
    }

    public void attachSession(String sessionId) {
        if (this.sessionId != null && !this.sessionId.equals(sessionId)) {
            throw new IllegalStateException("Event " + eventId + " is already linked to session " + this.sessionId);
        }
        this.sessionId = sessionId;
    }

    /**
     * Moves the event to a new session after the one it was linked to has closed.
     */
    public void relinkSession(String sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("Session id is required");
        }
        this.sessionId = sessionId;
    }

    public void recordOutcomes(List<NotificationOutcome> newOutcomes) {
        outcomes.addAll(newOutcomes);
    }

    public boolean hasSentOn(ChannelType channel) {
        return outcomes.stream().anyMatch(o -> o.channel() == channel && o.sent());
    }

    public void markProcessed(Instant at) {
        this.processed = true;
        this.processedAt = at;
        this.processingError = null;
    }

    public void markFailed(String error) {
        this.processed = false;
        this.processingError = error;
    }

    @Override
    public String toString() {
        return "SecurityEvent{" +
                "eventId=" + eventId +
                ", deviceId='" + deviceId + '\'' +
                ", type=" + type +
                ", timestamp=" + timestamp +
                ", sessionId='" + sessionId + '\'' +
                ", processed=" + processed +
                '}';
    }
}
