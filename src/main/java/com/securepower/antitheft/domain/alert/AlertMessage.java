package com.securepower.antitheft.domain.alert;

import com.securepower.antitheft.domain.tracking.LocationPoint;
import com.securepower.antitheft.domain.tracking.TrackingSession;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured content handed to a {@code NotificationSender}. Rendering into SMS text,
 * e-mail templates or push payloads is the sender's concern.
 */
public record AlertMessage(
        Kind kind,
        UUID eventId,
        AlertType alertType,
        String deviceId,
        String deviceName,
        String ownerName,
        Instant occurredAt,
        String sessionId,
        Map<String, String> details,
        LocationPoint location
) {
    public enum Kind {
        SECURITY_ALERT,
        TRACKING_SUMMARY
    }

    public static AlertMessage forEvent(SecurityEvent event, String deviceName, String ownerName) {
        return new AlertMessage(
                Kind.SECURITY_ALERT,
                event.getEventId(),
                event.getType(),
                event.getDeviceId(),
                deviceName,
                ownerName,
                event.getTimestamp(),
                event.getSessionId().orElse(null),
                event.getDetails(),
                event.getLocation().orElse(null)
        );
    }

    public static AlertMessage forSessionSummary(TrackingSession session, String deviceName, String ownerName) {
        Map<String, String> summary = new LinkedHashMap<>();
        summary.put("startTime", session.getStartTime().toString());
        summary.put("endTime", session.getEndTime() != null ? session.getEndTime().toString() : "");
        summary.put("closeReason", session.getCloseReason() != null ? session.getCloseReason().name() : "");
        summary.put("locationCount", String.valueOf(session.getLocationCount()));

        return new AlertMessage(
                Kind.TRACKING_SUMMARY,
                null,
                session.getAlertType(),
                session.getDeviceId(),
                deviceName,
                ownerName,
                session.getEndTime(),
                session.getSessionId(),
                summary,
                session.getLastLocation().orElse(null)
        );
    }
}
