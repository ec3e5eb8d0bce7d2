// ==============================================================================
// Security Event JPA Entity
// File: src/main/java/com/securepower/antitheft/infrastructure/jpa/SecurityEventEntity.java
// ==============================================================================

package com.securepower.antitheft.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "security_events", indexes = @Index(name = "idx_security_events_device", columnList = "device_id"))
public class SecurityEventEntity {

    @Id
    @Column(name = "event_id")
    private UUID eventId;

    @Column(name = "device_id", nullable = false, length = 128)
    private String deviceId;

    @Column(name = "user_id", length = 128)
    private String userId;

    @Column(name = "alert_type", nullable = false, length = 40)
    private String alertType;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    @Column(name = "details_json", columnDefinition = "TEXT")
    private String detailsJson;

    @Column(name = "location_json", columnDefinition = "TEXT")
    private String locationJson;

    @Column(name = "session_id", length = 160)
    private String sessionId;

    @Column(nullable = false)
    private boolean processed;

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    @Column(name = "processing_error", length = 1000)
    private String processingError;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "notification_outcomes", joinColumns = @JoinColumn(name = "event_id"))
    @OrderColumn(name = "outcome_index")
    private List<NotificationOutcomeEmbeddable> outcomes = new ArrayList<>();

    // Constructors
    public SecurityEventEntity() {}

    // Getters and Setters
    public UUID getEventId() { return eventId; }
    public void setEventId(UUID eventId) { this.eventId = eventId; }

    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getAlertType() { return alertType; }
    public void setAlertType(String alertType) { this.alertType = alertType; }

    public OffsetDateTime getOccurredAt() { return occurredAt; }
    public void setOccurredAt(OffsetDateTime occurredAt) { this.occurredAt = occurredAt; }

    public String getDetailsJson() { return detailsJson; }
    public void setDetailsJson(String detailsJson) { this.detailsJson = detailsJson; }

    public String getLocationJson() { return locationJson; }
    public void setLocationJson(String locationJson) { this.locationJson = locationJson; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public boolean isProcessed() { return processed; }
    public void setProcessed(boolean processed) { this.processed = processed; }

    public OffsetDateTime getProcessedAt() { return processedAt; }
    public void setProcessedAt(OffsetDateTime processedAt) { this.processedAt = processedAt; }

    public String getProcessingError() { return processingError; }
    public void setProcessingError(String processingError) { this.processingError = processingError; }

    public List<NotificationOutcomeEmbeddable> getOutcomes() { return outcomes; }
    public void setOutcomes(List<NotificationOutcomeEmbeddable> outcomes) { this.outcomes = outcomes; }

    @Override
    public String toString() {
        return "SecurityEventEntity{" +
                "eventId=" + eventId +
                ", deviceId='" + deviceId + '\'' +
                ", alertType='" + alertType + '\'' +
                ", occurredAt=" + occurredAt +
                ", processed=" + processed +
                '}';
    }
}
