// ==============================================================================
// Security Orchestrator - event intake, tracking and alert fan-out
// File: src/main/java/com/securepower/antitheft/application/SecurityOrchestrator.java
// ==============================================================================

package com.securepower.antitheft.application;

import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.alert.NotificationOutcome;
import com.securepower.antitheft.domain.alert.SecurityEvent;
import com.securepower.antitheft.domain.alert.UserProfile;
import com.securepower.antitheft.domain.device.DeviceRecord;
import com.securepower.antitheft.domain.ports.DeviceRepository;
import com.securepower.antitheft.domain.ports.SecurityEventRepository;
import com.securepower.antitheft.domain.ports.UserProfileRepository;
import com.securepower.antitheft.domain.tracking.LocationPoint;
import com.securepower.antitheft.domain.tracking.TrackingSession;
import com.securepower.antitheft.exception.DeviceNotFoundException;
import com.securepower.antitheft.exception.SecurityEventNotFoundException;
import com.securepower.antitheft.exception.UnrecoverableEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class SecurityOrchestrator implements AuthGate.EscalationPort {

    private static final Logger log = LoggerFactory.getLogger(SecurityOrchestrator.class);

    private final SecurityEventRepository events;
    private final DeviceRepository devices;
    private final UserProfileRepository users;
    private final TrackingService tracking;
    private final AlertDispatcher dispatcher;
    private final Executor executor;
    private final Clock clock;

    // Events of one device are processed one at a time
    private final ConcurrentHashMap<String, ReentrantLock> deviceLocks = new ConcurrentHashMap<>();

    public SecurityOrchestrator(SecurityEventRepository events,
                                DeviceRepository devices,
                                UserProfileRepository users,
                                TrackingService tracking,
                                AlertDispatcher dispatcher,
                                @Qualifier("securityEventExecutor") Executor executor,
                                Clock clock) {
        this.events = events;
        this.devices = devices;
        this.users = users;
        this.tracking = tracking;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Persists the event and schedules its processing. Returns without waiting for delivery.
     * A redelivered event that was already processed is not scheduled again.
     */
    @Override
    public void raise(SecurityEvent event) {
        event.requireIdentifiers();
        SecurityEvent stored = events.saveIfAbsent(event);
        if (stored.isProcessed()) {
            log.info("↩️ Event {} already processed - ignoring redelivery", stored.getEventId());
            return;
        }

        log.warn("🚨 Security event {} raised: {} on device {}", stored.getEventId(), stored.getType(), stored.getDeviceId());
        executor.execute(() -> {
            try {
                process(stored.getEventId());
            } catch (RuntimeException e) {
                log.error("❌ Processing of event {} failed: {}", stored.getEventId(), e.getMessage(), e);
            }
        });
    }

    /**
     * Builds an event for a trigger reported by the device and raises it.
     *
     * @throws DeviceNotFoundException when the device is not registered
     */
    public SecurityEvent report(String deviceId, AlertType type, Map<String, String> details, LocationPoint location) {
        DeviceRecord device = devices.findById(deviceId).orElseThrow(() -> new DeviceNotFoundException(deviceId));
        SecurityEvent event = SecurityEvent.raise(deviceId, device.getUserId(), type, clock.instant(), details, location);
        raise(event);
        return event;
    }

    /**
     * Processes a stored event: opens or joins the device's tracking session, flags the device
     * and dispatches alerts. Re-processing an event never opens a second session and never
     * resends a channel that already delivered.
     *
     * @throws UnrecoverableEventException when the device or its owner is unknown; the event
     *                                     is stored unprocessed with the error attached
     */
    public SecurityEvent process(UUID eventId) {
        SecurityEvent event = events.findById(eventId)
                .orElseThrow(() -> new SecurityEventNotFoundException(eventId));

        ReentrantLock lock = deviceLocks.computeIfAbsent(event.getDeviceId(), id -> new ReentrantLock());
        lock.lock();
        try {
            // reload: another worker may have finished it while we waited
            event = events.findById(eventId).orElseThrow();
            if (event.isProcessed()) {
                log.info("↩️ Event {} already processed", eventId);
                return event;
            }
            return processLocked(event);
        } finally {
            lock.unlock();
        }
    }

    public SecurityEvent get(UUID eventId) {
        return events.findById(eventId)
                .orElseThrow(() -> new SecurityEventNotFoundException(eventId));
    }

    public List<SecurityEvent> history(String deviceId) {
        return events.findByDevice(deviceId);
    }

    private SecurityEvent processLocked(SecurityEvent event) {
        UserProfile user;
        try {
            event.requireIdentifiers();
            devices.findById(event.getDeviceId())
                    .orElseThrow(() -> new UnrecoverableEventException(event.getEventId(),
                            "Device not registered: " + event.getDeviceId()));
            if (event.getUserId() == null) {
                throw new UnrecoverableEventException(event.getEventId(), "Event has no owning user");
            }
            user = users.findById(event.getUserId())
                    .orElseThrow(() -> new UnrecoverableEventException(event.getEventId(),
                            "User not found: " + event.getUserId()));

            TrackingSession session = tracking.open(event);
            Optional<String> linked = event.getSessionId();
            if (linked.isPresent() && !linked.get().equals(session.getSessionId())) {
                log.info("📍 Event {} moves from closed session {} to {}",
                        event.getEventId(), linked.get(), session.getSessionId());
                event.relinkSession(session.getSessionId());
            } else {
                event.attachSession(session.getSessionId());
            }
            events.save(event);

            devices.markUnderAlert(event.getDeviceId(), event.getType(), event.getTimestamp());
        } catch (RuntimeException e) {
            log.error("❌ Event {} cannot be processed: {}", event.getEventId(), e.getMessage());
            event.markFailed(e.getMessage());
            events.save(event);
            throw e;
        }

        List<NotificationOutcome> outcomes = dispatcher.dispatch(event, user);
        log.info("✅ Event {} handled - session: {}, channels: {}",
                event.getEventId(), event.getSessionId().orElse(null), outcomes.size());
        return event;
    }

    /**
     * Returns the device to normal status and sends the session summary off-thread.
     */
    @EventListener
    public void onTrackingSessionClosed(TrackingSessionClosedEvent closed) {
        TrackingSession session = closed.session();
        devices.markActive(session.getDeviceId());

        executor.execute(() -> {
            try {
                users.findById(session.getUserId()).ifPresentOrElse(
                        user -> dispatcher.dispatchSummary(session, user),
                        () -> log.warn("⚠️ No user {} for summary of session {}", session.getUserId(), session.getSessionId()));
            } catch (RuntimeException e) {
                log.error("❌ Summary for session {} failed: {}", session.getSessionId(), e.getMessage(), e);
            }
        });
    }
}
