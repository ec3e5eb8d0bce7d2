// ==============================================================================
// Tracking Service - session lifecycle and bounded location logs
// File: src/main/java/com/securepower/antitheft/application/TrackingService.java
// ==============================================================================

package com.securepower.antitheft.application;

import com.securepower.antitheft.config.AppProperties;
import com.securepower.antitheft.domain.alert.SecurityEvent;
import com.securepower.antitheft.domain.ports.DeviceRepository;
import com.securepower.antitheft.domain.ports.ReverseGeocoder;
import com.securepower.antitheft.domain.ports.TrackingSessionRepository;
import com.securepower.antitheft.domain.tracking.CloseReason;
import com.securepower.antitheft.domain.tracking.LocationLog;
import com.securepower.antitheft.domain.tracking.LocationPoint;
import com.securepower.antitheft.domain.tracking.TrackingSession;
import com.securepower.antitheft.exception.TrackingSessionInactiveException;
import com.securepower.antitheft.exception.TrackingSessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns tracking sessions from open to close. Every mutation of one session runs under that
 * session's lock, so an append arriving after a close is rejected rather than queued.
 */
@Service
public class TrackingService {

    private static final Logger log = LoggerFactory.getLogger(TrackingService.class);

    private final TrackingSessionRepository sessions;
    private final DeviceRepository devices;
    private final ReverseGeocoder geocoder;
    private final ApplicationEventPublisher publisher;
    private final Executor enrichmentExecutor;
    private final Clock clock;

    // Configuration
    private final int retentionCap;
    private final Duration maxAge;

    private final ConcurrentHashMap<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();

    public TrackingService(TrackingSessionRepository sessions,
                           DeviceRepository devices,
                           ReverseGeocoder geocoder,
                           ApplicationEventPublisher publisher,
                           @Qualifier("securityEventExecutor") Executor enrichmentExecutor,
                           AppProperties props,
                           Clock clock) {
        this.sessions = sessions;
        this.devices = devices;
        this.geocoder = geocoder;
        this.publisher = publisher;
        this.enrichmentExecutor = enrichmentExecutor;
        this.clock = clock;
        this.retentionCap = props.getTracking().getRetentionCap();
        this.maxAge = props.getTracking().getMaxAge();

        log.info("✅ Tracking service initialized - RetentionCap: {}, MaxAge: {}h", retentionCap, maxAge.toHours());
    }

    /**
     * Returns the session for the event, creating it only when neither the event's own
     * session nor another session of the device is still active. Safe to call repeatedly for
     * the same event. When the event's own session has already closed, tracking starts again
     * under a new session.
     */
    public TrackingSession open(SecurityEvent event) {
        Optional<TrackingSession> previous = event.getSessionId().flatMap(sessions::findById);
        if (previous.isPresent() && previous.get().isActive()) {
            log.debug("Event {} already tracked by session {}", event.getEventId(), previous.get().getSessionId());
            return previous.get();
        }

        Optional<TrackingSession> active = sessions.findActiveByDevice(event.getDeviceId());
        if (active.isPresent()) {
            log.info("📍 Event {} joins active session {}", event.getEventId(), active.get().getSessionId());
            return active.get();
        }

        TrackingSession candidate;
        if (previous.isPresent()) {
            log.info("📍 Session {} of event {} already closed - tracking again",
                    previous.get().getSessionId(), event.getEventId());
            candidate = TrackingSession.open(event.getDeviceId(), event.getUserId(), event.getType(),
                    clock.instant(), retentionCap);
        } else {
            candidate = event.getSessionId()
                    .map(id -> TrackingSession.open(id, event.getDeviceId(), event.getUserId(), event.getType(),
                            event.getTimestamp(), retentionCap))
                    .orElseGet(() -> TrackingSession.open(event.getDeviceId(), event.getUserId(), event.getType(),
                            event.getTimestamp(), retentionCap));
        }

        TrackingSession stored = sessions.createIfAbsent(candidate);
        log.info("📍 Tracking session {} open for device {} ({})",
                stored.getSessionId(), stored.getDeviceId(), stored.getAlertType());
        return stored;
    }

    /**
     * Adds a point to an active session and evicts the oldest points beyond the retention cap.
     * A point whose timestamp is already recorded is ignored.
     *
     * @throws TrackingSessionNotFoundException when the session is unknown
     * @throws TrackingSessionInactiveException when the session is closed or just outlived its age limit
     */
    public TrackingSession append(String sessionId, LocationPoint point) {
        TrackingSession session;
        boolean stored;

        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            TrackingSession current = load(sessionId);
            session = current;
            Instant now = clock.instant();

            if (session.isActive() && session.isOlderThan(maxAge, now)) {
                closeLocked(session, CloseReason.AGE_LIMIT, now);
            }

            LocationLog.Insertion insertion = session.append(point, now);
            stored = insertion.stored();
            if (stored) {
                sessions.appendLocation(sessionId, point, insertion.evicted());
                sessions.save(session);
                current.getLastLocation().ifPresent(latest -> devices.updateLastLocation(current.getDeviceId(), latest));
                if (!insertion.evicted().isEmpty()) {
                    log.debug("Session {} at cap {} - evicted {} point(s)",
                            sessionId, retentionCap, insertion.evicted().size());
                }
            } else {
                log.debug("Ignored point at {} for session {}", point.timestamp(), sessionId);
            }
        } finally {
            lock.unlock();
        }

        if (stored && point.address() == null) {
            enrichmentExecutor.execute(() -> resolveAddress(sessionId, point));
        }
        return session;
    }

    /**
     * Closes the session when it has outlived the maximum tracking age.
     *
     * @return true only for the call that performed the close
     */
    public boolean maybeExpire(String sessionId) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            TrackingSession session = load(sessionId);
            Instant now = clock.instant();
            if (!session.isActive() || !session.isOlderThan(maxAge, now)) {
                return false;
            }
            return closeLocked(session, CloseReason.AGE_LIMIT, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the session. Closing a closed session returns it unchanged.
     */
    public TrackingSession close(String sessionId, CloseReason reason) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            TrackingSession session = load(sessionId);
            if (!closeLocked(session, reason, clock.instant())) {
                log.debug("Session {} already closed ({})", sessionId, session.getCloseReason());
            }
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Expiry sweep over all active sessions.
     *
     * @return number of sessions closed
     */
    public int expireStaleSessions() {
        int closed = 0;
        for (String sessionId : sessions.findActiveSessionIds()) {
            try {
                if (maybeExpire(sessionId)) {
                    closed++;
                }
            } catch (RuntimeException e) {
                log.error("❌ Expiry check failed for session {}: {}", sessionId, e.getMessage(), e);
            }
        }
        return closed;
    }

    public TrackingSession get(String sessionId) {
        return load(sessionId);
    }

    public List<LocationPoint> locations(String sessionId) {
        return load(sessionId).getLocations();
    }

    private boolean closeLocked(TrackingSession session, CloseReason reason, Instant now) {
        if (!session.close(now, reason)) {
            return false;
        }
        sessions.save(session);
        log.info("🛑 Tracking session {} closed - reason: {}, points: {}",
                session.getSessionId(), reason, session.getLocationCount());
        publisher.publishEvent(new TrackingSessionClosedEvent(session));
        return true;
    }

    private void resolveAddress(String sessionId, LocationPoint point) {
        try {
            Optional<String> address = geocoder.resolve(point.lat(), point.lng());
            if (address.isEmpty()) {
                return;
            }
            ReentrantLock lock = lockFor(sessionId);
            lock.lock();
            try {
                sessions.updateLocationAddress(sessionId, point.withAddress(address.get()));
            } finally {
                lock.unlock();
            }
        } catch (RuntimeException e) {
            log.warn("⚠️ Address lookup failed for session {} at {}: {}", sessionId, point.timestamp(), e.getMessage());
        }
    }

    private TrackingSession load(String sessionId) {
        return sessions.findById(sessionId).orElseThrow(() -> new TrackingSessionNotFoundException(sessionId));
    }

    private ReentrantLock lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, id -> new ReentrantLock());
    }
}
