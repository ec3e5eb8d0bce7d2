package com.securepower.antitheft.domain.tracking;

import java.time.Instant;

/**
 * A single recorded fix. Only {@code address} is filled in after recording.
 */
public record LocationPoint(
        double lat,
        double lng,
        double accuracy,
        Instant timestamp,
        Double speed,
        Double bearing,
        Double altitude,
        Integer batteryLevel,
        String connectionType,
        String address
) {
    public LocationPoint {
        if (timestamp == null) {
            throw new IllegalArgumentException("Location timestamp is required");
        }
        if (lat < -90 || lat > 90 || lng < -180 || lng > 180) {
            throw new IllegalArgumentException("Coordinates out of range: " + lat + ", " + lng);
        }
    }

    public static LocationPoint of(double lat, double lng, double accuracy, Instant timestamp) {
        return new LocationPoint(lat, lng, accuracy, timestamp, null, null, null, null, null, null);
    }

    public LocationPoint withAddress(String resolvedAddress) {
        return new LocationPoint(lat, lng, accuracy, timestamp, speed, bearing, altitude,
                batteryLevel, connectionType, resolvedAddress);
    }
}
