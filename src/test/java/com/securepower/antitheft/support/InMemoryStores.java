package com.securepower.antitheft.support;

import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.alert.ChannelType;
import com.securepower.antitheft.domain.alert.SecurityEvent;
import com.securepower.antitheft.domain.alert.UserProfile;
import com.securepower.antitheft.domain.credential.AttemptState;
import com.securepower.antitheft.domain.credential.CredentialKind;
import com.securepower.antitheft.domain.credential.StoredCredential;
import com.securepower.antitheft.domain.device.DeviceRecord;
import com.securepower.antitheft.domain.device.DeviceStatus;
import com.securepower.antitheft.domain.ports.AttemptStateRepository;
import com.securepower.antitheft.domain.ports.ChannelSendLogRepository;
import com.securepower.antitheft.domain.ports.CredentialRepository;
import com.securepower.antitheft.domain.ports.DeviceRepository;
import com.securepower.antitheft.domain.ports.SecurityEventRepository;
import com.securepower.antitheft.domain.ports.TrackingSessionRepository;
import com.securepower.antitheft.domain.ports.UserProfileRepository;
import com.securepower.antitheft.domain.tracking.LocationLog;
import com.securepower.antitheft.domain.tracking.LocationPoint;
import com.securepower.antitheft.domain.tracking.TrackingSession;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Map-backed implementations of every storage port. Objects are copied on the way in and out
 * so tests observe only what was explicitly saved.
 */
public final class InMemoryStores {

    private InMemoryStores() {
    }

    public static class Credentials implements CredentialRepository {
        private final Map<String, StoredCredential> store = new ConcurrentHashMap<>();

        @Override
        public Optional<StoredCredential> find(String deviceId, CredentialKind kind) {
            return Optional.ofNullable(store.get(deviceId + ":" + kind));
        }

        @Override
        public void save(StoredCredential credential) {
            store.put(credential.getDeviceId() + ":" + credential.getKind(), credential);
        }

        @Override
        public void deleteAll(String deviceId) {
            store.keySet().removeIf(key -> key.startsWith(deviceId + ":"));
        }
    }

    public static class Attempts implements AttemptStateRepository {
        private final Map<String, AttemptState> store = new ConcurrentHashMap<>();

        @Override
        public Optional<AttemptState> find(String deviceId) {
            return Optional.ofNullable(store.get(deviceId)).map(Attempts::copy);
        }

        @Override
        public void save(AttemptState state) {
            store.put(state.getDeviceId(), copy(state));
        }

        private static AttemptState copy(AttemptState s) {
            return new AttemptState(s.getDeviceId(), s.getFailedCount(), s.getLastAttemptAt(), s.getLockoutUntil());
        }
    }

    public static class Events implements SecurityEventRepository {
        private final Map<UUID, SecurityEvent> store = new ConcurrentHashMap<>();

        @Override
        public SecurityEvent saveIfAbsent(SecurityEvent event) {
            return copy(store.computeIfAbsent(event.getEventId(), id -> copy(event)));
        }

        @Override
        public Optional<SecurityEvent> findById(UUID eventId) {
            return Optional.ofNullable(store.get(eventId)).map(Events::copy);
        }

        @Override
        public void save(SecurityEvent event) {
            store.put(event.getEventId(), copy(event));
        }

        @Override
        public List<SecurityEvent> findByDevice(String deviceId) {
            return store.values().stream()
                    .filter(e -> e.getDeviceId().equals(deviceId))
                    .sorted(Comparator.comparing(SecurityEvent::getTimestamp).reversed())
                    .map(Events::copy)
                    .toList();
        }

        public int size() {
            return store.size();
        }

        private static SecurityEvent copy(SecurityEvent e) {
            return new SecurityEvent(e.getEventId(), e.getDeviceId(), e.getUserId(), e.getType(), e.getTimestamp(),
                    e.getDetails(), e.getLocation().orElse(null), e.getSessionId().orElse(null), e.isProcessed(),
                    e.getProcessedAt(), e.getProcessingError(), e.getOutcomes());
        }
    }

    public static class Sessions implements TrackingSessionRepository {
        private final int retentionCap;
        private final Map<String, TrackingSession> meta = new ConcurrentHashMap<>();
        private final Map<String, NavigableMap<Instant, LocationPoint>> points = new ConcurrentHashMap<>();

        public Sessions(int retentionCap) {
            this.retentionCap = retentionCap;
        }

        @Override
        public synchronized TrackingSession createIfAbsent(TrackingSession session) {
            if (!meta.containsKey(session.getSessionId())) {
                meta.put(session.getSessionId(), session);
                points.put(session.getSessionId(), new ConcurrentSkipListMap<>());
            }
            return load(session.getSessionId());
        }

        @Override
        public Optional<TrackingSession> findById(String sessionId) {
            return meta.containsKey(sessionId) ? Optional.of(load(sessionId)) : Optional.empty();
        }

        @Override
        public Optional<TrackingSession> findActiveByDevice(String deviceId) {
            return meta.values().stream()
                    .filter(s -> s.isActive() && s.getDeviceId().equals(deviceId))
                    .max(Comparator.comparing(TrackingSession::getStartTime))
                    .map(s -> load(s.getSessionId()));
        }

        @Override
        public List<String> findActiveSessionIds() {
            return meta.values().stream().filter(TrackingSession::isActive).map(TrackingSession::getSessionId).toList();
        }

        @Override
        public void save(TrackingSession s) {
            meta.put(s.getSessionId(), new TrackingSession(s.getSessionId(), s.getDeviceId(), s.getUserId(),
                    s.getAlertType(), s.isActive(), s.getStartTime(), s.getEndTime(), s.getCloseReason(),
                    s.getLastUpdate(), new LocationLog(retentionCap)));
        }

        @Override
        public void appendLocation(String sessionId, LocationPoint point, List<LocationPoint> evicted) {
            NavigableMap<Instant, LocationPoint> log = points.get(sessionId);
            evicted.forEach(p -> log.remove(p.timestamp()));
            log.put(point.timestamp(), point);
        }

        @Override
        public void updateLocationAddress(String sessionId, LocationPoint resolved) {
            points.get(sessionId).computeIfPresent(resolved.timestamp(), (ts, p) -> resolved);
        }

        public int storedPointCount(String sessionId) {
            return points.get(sessionId).size();
        }

        public int sessionCount() {
            return meta.size();
        }

        private TrackingSession load(String sessionId) {
            TrackingSession s = meta.get(sessionId);
            return new TrackingSession(s.getSessionId(), s.getDeviceId(), s.getUserId(), s.getAlertType(),
                    s.isActive(), s.getStartTime(), s.getEndTime(), s.getCloseReason(), s.getLastUpdate(),
                    LocationLog.of(retentionCap, points.get(sessionId).values()));
        }
    }

    public static class Devices implements DeviceRepository {
        private final Map<String, DeviceRecord> store = new ConcurrentHashMap<>();

        @Override
        public Optional<DeviceRecord> findById(String deviceId) {
            return Optional.ofNullable(store.get(deviceId));
        }

        @Override
        public DeviceRecord save(DeviceRecord device) {
            store.put(device.getDeviceId(), device);
            return device;
        }

        @Override
        public void markUnderAlert(String deviceId, AlertType type, Instant at) {
            store.computeIfPresent(deviceId, (id, d) -> new DeviceRecord(id, d.getUserId(), d.getDeviceName(),
                    d.getModel(), DeviceStatus.SECURITY_ALERT, at, type, d.getLastLocation()));
        }

        @Override
        public void markActive(String deviceId) {
            store.computeIfPresent(deviceId, (id, d) -> new DeviceRecord(id, d.getUserId(), d.getDeviceName(),
                    d.getModel(), DeviceStatus.ACTIVE, d.getLastAlert(), d.getLastAlertType(), d.getLastLocation()));
        }

        @Override
        public void updateLastLocation(String deviceId, LocationPoint location) {
            store.computeIfPresent(deviceId, (id, d) -> new DeviceRecord(id, d.getUserId(), d.getDeviceName(),
                    d.getModel(), d.getStatus(), d.getLastAlert(), d.getLastAlertType(), location));
        }
    }

    public static class Users implements UserProfileRepository {
        private final Map<String, UserProfile> store = new ConcurrentHashMap<>();

        @Override
        public Optional<UserProfile> findById(String userId) {
            return userId == null ? Optional.empty() : Optional.ofNullable(store.get(userId));
        }

        @Override
        public UserProfile save(UserProfile profile) {
            store.put(profile.getUserId(), profile);
            return profile;
        }
    }

    public static class SendLog implements ChannelSendLogRepository {
        private final Map<String, Instant> store = new ConcurrentHashMap<>();

        @Override
        public Optional<Instant> lastSentAt(String userId, ChannelType channel) {
            return Optional.ofNullable(store.get(userId + ":" + channel));
        }

        @Override
        public void recordSent(String userId, ChannelType channel, Instant sentAt) {
            store.put(userId + ":" + channel, sentAt);
        }

        @Override
        public void clear(String userId, ChannelType channel) {
            store.remove(userId + ":" + channel);
        }
    }
}
