package com.securepower.antitheft.domain.credential;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-device failed attempt counter and lockout deadline.
 * Only mutated by {@code AuthGate} while holding the device lock.
 */
public class AttemptState {
    private final String deviceId;
    private int failedCount;
    private Instant lastAttemptAt;
    private Instant lockoutUntil;

    public AttemptState(String deviceId, int failedCount, Instant lastAttemptAt, Instant lockoutUntil) {
        this.deviceId = deviceId;
        this.failedCount = failedCount;
        this.lastAttemptAt = lastAttemptAt;
        this.lockoutUntil = lockoutUntil;
    }

    public static AttemptState initial(String deviceId) {
        return new AttemptState(deviceId, 0, null, null);
    }

    public String getDeviceId() { return deviceId; }
    public int getFailedCount() { return failedCount; }
    public Instant getLastAttemptAt() { return lastAttemptAt; }
    public Instant getLockoutUntil() { return lockoutUntil; }

    // Locked strictly before the deadline; the deadline instant itself is unlocked.
    public boolean isLockedOut(Instant now) {
        return lockoutUntil != null && now.isBefore(lockoutUntil);
    }

    public long remainingLockoutSeconds(Instant now) {
        if (!isLockedOut(now)) {
            return 0;
        }
        return Duration.between(now, lockoutUntil).toMillis() / 1000;
    }

    public int recordFailure(Instant now) {
        failedCount++;
        lastAttemptAt = now;
        return failedCount;
    }

    public void lockUntil(Instant until) {
        this.lockoutUntil = until;
    }

    public void reset(Instant now) {
        failedCount = 0;
        lockoutUntil = null;
        lastAttemptAt = now;
    }
}
