// ==============================================================================
// Tracking Session Aggregate
// File: src/main/java/com/securepower/antitheft/domain/tracking/TrackingSession.java
// ==============================================================================

package com.securepower.antitheft.domain.tracking;

import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.exception.TrackingSessionInactiveException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Location tracking started by a security alert. A session goes from active to inactive
 * exactly once; an inactive session accepts no further points.
 */
public class TrackingSession {
    private final String sessionId;
    private final String deviceId;
    private final String userId;
    private final AlertType alertType;
    private final Instant startTime;
    private final LocationLog locations;

    private boolean active;
    private Instant endTime;
    private CloseReason closeReason;
    private Instant lastUpdate;

    public TrackingSession(String sessionId, String deviceId, String userId, AlertType alertType,
                           boolean active, Instant startTime, Instant endTime, CloseReason closeReason,
                           Instant lastUpdate, LocationLog locations) {
        this.sessionId = sessionId;
        this.deviceId = deviceId;
        this.userId = userId;
        this.alertType = alertType;
        this.active = active;
        this.startTime = startTime;
        this.endTime = endTime;
        this.closeReason = closeReason;
        this.lastUpdate = lastUpdate;
        this.locations = locations;
    }

    public static TrackingSession open(String deviceId, String userId, AlertType alertType,
                                       Instant startTime, int retentionCap) {
        return open(sessionIdFor(deviceId, startTime), deviceId, userId, alertType, startTime, retentionCap);
    }

    public static TrackingSession open(String sessionId, String deviceId, String userId, AlertType alertType,
                                       Instant startTime, int retentionCap) {
        return new TrackingSession(sessionId, deviceId, userId, alertType,
                true, startTime, null, null, null, new LocationLog(retentionCap));
    }

    /**
     * Session ids are derived from the device and the triggering instant, so redelivery of
     * the same trigger maps onto the same session.
     */
    public static String sessionIdFor(String deviceId, Instant startTime) {
        return deviceId + "_" + startTime.toEpochMilli();
    }

    // Getters
    public String getSessionId() { return sessionId; }
    public String getDeviceId() { return deviceId; }
    public String getUserId() { return userId; }
    public AlertType getAlertType() { return alertType; }
    public boolean isActive() { return active; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public CloseReason getCloseReason() { return closeReason; }
    public Instant getLastUpdate() { return lastUpdate; }
    public Optional<LocationPoint> getLastLocation() { return locations.latest(); }
    public int getLocationCount() { return locations.size(); }
    public List<LocationPoint> getLocations() { return locations.snapshot(); }

    public LocationLog.Insertion append(LocationPoint point, Instant now) {
        if (!active) {
            throw new TrackingSessionInactiveException(sessionId);
        }
        LocationLog.Insertion insertion = locations.add(point);
        if (insertion.stored()) {
            lastUpdate = now;
        }
        return insertion;
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return Duration.between(startTime, now).compareTo(maxAge) > 0;
    }

    /**
     * @return false when the session was already closed
     */
    public boolean close(Instant now, CloseReason reason) {
        if (!active) {
            return false;
        }
        active = false;
        endTime = now;
        closeReason = reason;
        return true;
    }
}
