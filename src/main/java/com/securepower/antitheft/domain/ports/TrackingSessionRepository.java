package com.securepower.antitheft.domain.ports;

import com.securepower.antitheft.domain.tracking.LocationPoint;
import com.securepower.antitheft.domain.tracking.TrackingSession;

import java.util.List;
import java.util.Optional;

public interface TrackingSessionRepository {

    /**
     * Atomic create-if-absent keyed by session id.
     *
     * @return the stored session, which is the existing one if the id was taken
     */
    TrackingSession createIfAbsent(TrackingSession session);

    Optional<TrackingSession> findById(String sessionId);

    Optional<TrackingSession> findActiveByDevice(String deviceId);

    List<String> findActiveSessionIds();

    /**
     * Persists session state (activity, close data, last update). Locations are written
     * through {@link #appendLocation}.
     */
    void save(TrackingSession session);

    void appendLocation(String sessionId, LocationPoint point, List<LocationPoint> evicted);

    void updateLocationAddress(String sessionId, LocationPoint resolved);
}
