package com.securepower.antitheft.infrastructure.adapters;

import com.securepower.antitheft.config.AppProperties;
import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.ports.TrackingSessionRepository;
import com.securepower.antitheft.domain.tracking.CloseReason;
import com.securepower.antitheft.domain.tracking.LocationLog;
import com.securepower.antitheft.domain.tracking.LocationPoint;
import com.securepower.antitheft.domain.tracking.TrackingSession;
import com.securepower.antitheft.infrastructure.jpa.LocationPointEntity;
import com.securepower.antitheft.infrastructure.jpa.SpringLocationPointRepository;
import com.securepower.antitheft.infrastructure.jpa.SpringTrackingSessionRepository;
import com.securepower.antitheft.infrastructure.jpa.TrackingSessionEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.fromColumn;
import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.toColumn;

/**
 * Sessions and their points live in separate tables; a session is reassembled with its
 * points in timestamp order on every load.
 */
@Component
public class JpaTrackingSessionRepositoryAdapter implements TrackingSessionRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaTrackingSessionRepositoryAdapter.class);

    private final SpringTrackingSessionRepository sessions;
    private final SpringLocationPointRepository locations;
    private final int retentionCap;

    public JpaTrackingSessionRepositoryAdapter(SpringTrackingSessionRepository sessions,
                                               SpringLocationPointRepository locations,
                                               AppProperties props) {
        this.sessions = sessions;
        this.locations = locations;
        this.retentionCap = props.getTracking().getRetentionCap();
    }

    @Override
    public TrackingSession createIfAbsent(TrackingSession session) {
        Optional<TrackingSession> existing = findById(session.getSessionId());
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            sessions.saveAndFlush(toEntity(session));
            return session;
        } catch (DataIntegrityViolationException e) {
            log.info("Tracking session {} created concurrently - loading existing row", session.getSessionId());
            return findById(session.getSessionId()).orElseThrow(() -> e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TrackingSession> findById(String sessionId) {
        return sessions.findById(sessionId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TrackingSession> findActiveByDevice(String deviceId) {
        return sessions.findFirstByDeviceIdAndActiveTrueOrderByStartTimeDesc(deviceId).map(this::toDomain);
    }

    @Override
    public List<String> findActiveSessionIds() {
        return sessions.findActiveSessionIds();
    }

    @Override
    @Transactional
    public void save(TrackingSession session) {
        sessions.save(toEntity(session));
    }

    @Override
    @Transactional
    public void appendLocation(String sessionId, LocationPoint point, List<LocationPoint> evicted) {
        if (!evicted.isEmpty()) {
            List<OffsetDateTime> evictedAt = evicted.stream().map(p -> toColumn(p.timestamp())).toList();
            locations.deleteBySessionIdAndRecordedAtIn(sessionId, evictedAt);
        }

        LocationPointEntity e = new LocationPointEntity();
        e.setSessionId(sessionId);
        e.setRecordedAt(toColumn(point.timestamp()));
        e.setLatitude(point.lat());
        e.setLongitude(point.lng());
        e.setAccuracy(point.accuracy());
        e.setSpeed(point.speed());
        e.setBearing(point.bearing());
        e.setAltitude(point.altitude());
        e.setBatteryLevel(point.batteryLevel());
        e.setConnectionType(point.connectionType());
        e.setAddress(point.address());
        locations.save(e);
    }

    @Override
    @Transactional
    public void updateLocationAddress(String sessionId, LocationPoint resolved) {
        locations.findBySessionIdAndRecordedAt(sessionId, toColumn(resolved.timestamp()))
                .ifPresent(e -> {
                    e.setAddress(resolved.address());
                    locations.save(e);
                });
    }

    private TrackingSessionEntity toEntity(TrackingSession s) {
        TrackingSessionEntity e = new TrackingSessionEntity();
        e.setSessionId(s.getSessionId());
        e.setDeviceId(s.getDeviceId());
        e.setUserId(s.getUserId());
        e.setAlertType(s.getAlertType().name());
        e.setActive(s.isActive());
        e.setStartTime(toColumn(s.getStartTime()));
        e.setEndTime(toColumn(s.getEndTime()));
        e.setCloseReason(s.getCloseReason() != null ? s.getCloseReason().name() : null);
        e.setLastUpdate(toColumn(s.getLastUpdate()));
        return e;
    }

    private TrackingSession toDomain(TrackingSessionEntity e) {
        List<LocationPoint> points = locations.findBySessionIdOrderByRecordedAtAsc(e.getSessionId()).stream()
                .map(p -> new LocationPoint(
                        p.getLatitude(),
                        p.getLongitude(),
                        p.getAccuracy(),
                        fromColumn(p.getRecordedAt()),
                        p.getSpeed(),
                        p.getBearing(),
                        p.getAltitude(),
                        p.getBatteryLevel(),
                        p.getConnectionType(),
                        p.getAddress()))
                .toList();

        return new TrackingSession(
                e.getSessionId(),
                e.getDeviceId(),
                e.getUserId(),
                AlertType.valueOf(e.getAlertType()),
                e.isActive(),
                fromColumn(e.getStartTime()),
                fromColumn(e.getEndTime()),
                e.getCloseReason() != null ? CloseReason.valueOf(e.getCloseReason()) : null,
                fromColumn(e.getLastUpdate()),
                LocationLog.of(retentionCap, points));
    }
}
