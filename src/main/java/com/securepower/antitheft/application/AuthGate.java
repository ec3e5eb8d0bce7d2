// ==============================================================================
// Credential Gate - attempt counting, lockout and escalation
// File: src/main/java/com/securepower/antitheft/application/AuthGate.java
// ==============================================================================

package com.securepower.antitheft.application;

import com.securepower.antitheft.config.AppProperties;
import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.alert.SecurityEvent;
import com.securepower.antitheft.domain.credential.AttemptState;
import com.securepower.antitheft.domain.credential.AuthOutcome;
import com.securepower.antitheft.domain.credential.CredentialKind;
import com.securepower.antitheft.domain.device.DeviceRecord;
import com.securepower.antitheft.domain.ports.AttemptStateRepository;
import com.securepower.antitheft.domain.ports.DeviceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class AuthGate {

    private static final Logger log = LoggerFactory.getLogger(AuthGate.class);

    /**
     * Receiver of escalations. Must return without waiting for alert delivery.
     */
    public interface EscalationPort {
        void raise(SecurityEvent event);
    }

    private final CredentialStore credentialStore;
    private final AttemptStateRepository attempts;
    private final DeviceRepository devices;
    private final EscalationPort escalation;
    private final Clock clock;

    // Configuration
    private final int failureThreshold;
    private final Duration lockoutDuration;

    private final ConcurrentHashMap<String, ReentrantLock> deviceLocks = new ConcurrentHashMap<>();

    public AuthGate(CredentialStore credentialStore,
                    AttemptStateRepository attempts,
                    DeviceRepository devices,
                    EscalationPort escalation,
                    AppProperties props,
                    Clock clock) {
        this.credentialStore = credentialStore;
        this.attempts = attempts;
        this.devices = devices;
        this.escalation = escalation;
        this.clock = clock;
        this.failureThreshold = props.getAuth().getFailureThreshold();
        this.lockoutDuration = props.getAuth().getLockoutDuration();

        log.info("✅ Auth gate initialized - FailureThreshold: {}, LockoutDuration: {}s",
                failureThreshold, lockoutDuration.toSeconds());
    }

    /**
     * Checks a credential and advances the device's attempt state. Calls for the same device
     * are serialized.
     */
    public AuthOutcome verify(String deviceId, CredentialKind kind, String rawCredential) {
        ReentrantLock lock = lockFor(deviceId);
        lock.lock();
        try {
            return verifyLocked(deviceId, kind, rawCredential);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a new or replacement credential once an existing one has been verified. The check
     * counts like any other attempt: a wrong value advances the counter and a running lockout
     * refuses the change.
     *
     * @return the outcome of checking the existing credential; the change is stored only on Success
     * @throws com.securepower.antitheft.exception.InvalidCredentialFormatException before any check
     *         when the new value does not satisfy its kind's format
     */
    public AuthOutcome changeCredential(String deviceId, CredentialKind currentKind, String currentValue,
                                        CredentialKind newKind, String newValue) {
        credentialStore.requireFormat(deviceId, newKind, newValue);
        return verifyThen(deviceId, currentKind, currentValue,
                () -> credentialStore.store(deviceId, newKind, newValue));
    }

    /**
     * Account recovery: removes both credentials once either one has been verified, typically the
     * password when the PIN is forgotten.
     */
    public AuthOutcome resetCredentials(String deviceId, CredentialKind kind, String value) {
        return verifyThen(deviceId, kind, value, () -> credentialStore.clear(deviceId));
    }

    public AttemptState status(String deviceId) {
        return attempts.find(deviceId).orElseGet(() -> AttemptState.initial(deviceId));
    }

    private AuthOutcome verifyThen(String deviceId, CredentialKind kind, String rawCredential, Runnable onSuccess) {
        ReentrantLock lock = lockFor(deviceId);
        lock.lock();
        try {
            AuthOutcome outcome = verifyLocked(deviceId, kind, rawCredential);
            if (outcome instanceof AuthOutcome.Success) {
                onSuccess.run();
            }
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    private AuthOutcome verifyLocked(String deviceId, CredentialKind kind, String rawCredential) {
        Instant now = clock.instant();
        AttemptState state = status(deviceId);

        if (state.isLockedOut(now)) {
            long remaining = state.remainingLockoutSeconds(now);
            log.warn("🔒 Device {} is locked out for another {}s", deviceId, remaining);
            return new AuthOutcome.LockedOut(remaining);
        }

        if (!credentialStore.isConfigured(deviceId, kind)) {
            log.debug("No {} configured for device {}", kind, deviceId);
            return new AuthOutcome.NotConfigured();
        }

        if (credentialStore.verify(deviceId, kind, rawCredential)) {
            state.reset(now);
            attempts.save(state);
            log.info("✅ {} verified for device {}", kind, deviceId);
            return new AuthOutcome.Success();
        }

        int failed = state.recordFailure(now);

        if (failed > failureThreshold) {
            state.lockUntil(now.plus(lockoutDuration));
            attempts.save(state);
            log.warn("🚨 Device {} failed {} verification #{} - locked for {}s",
                    deviceId, kind, failed, lockoutDuration.toSeconds());
            if (failed == failureThreshold + 1) {
                escalate(deviceId, failed, now);
            }
            return new AuthOutcome.FailedWithAlert(failed, lockoutDuration.toSeconds());
        }

        attempts.save(state);

        if (failed == failureThreshold) {
            log.warn("⚠️ Device {} failed {} verification #{} - next failure escalates", deviceId, kind, failed);
            return new AuthOutcome.FailedAtThreshold(failed);
        }

        log.info("❌ Device {} failed {} verification #{}", deviceId, kind, failed);
        return new AuthOutcome.Failed(failed);
    }

    private void escalate(String deviceId, int failedAttempts, Instant now) {
        String userId = devices.findById(deviceId).map(DeviceRecord::getUserId).orElse(null);
        if (userId == null) {
            log.warn("⚠️ Escalating for unregistered device {}", deviceId);
        }

        SecurityEvent event = SecurityEvent.raise(deviceId, userId, AlertType.FAILED_AUTH_THRESHOLD, now,
                Map.of("failedAttempts", String.valueOf(failedAttempts)), null);
        try {
            escalation.raise(event);
        } catch (RuntimeException e) {
            // The lockout already stands; the caller still gets its outcome
            log.error("❌ Failed to raise escalation {} for device {}: {}",
                    event.getEventId(), deviceId, e.getMessage(), e);
        }
    }

    private ReentrantLock lockFor(String deviceId) {
        return deviceLocks.computeIfAbsent(deviceId, id -> new ReentrantLock());
    }
}
