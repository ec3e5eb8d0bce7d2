package com.securepower.antitheft.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;

@Entity
@Table(name = "auth_attempt_state")
public class AttemptStateEntity {

    @Id
    @Column(name = "device_id", length = 128)
    private String deviceId;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    @Column(name = "last_attempt_at")
    private OffsetDateTime lastAttemptAt;

    @Column(name = "lockout_until")
    private OffsetDateTime lockoutUntil;

    public AttemptStateEntity() {}

    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }

    public int getFailedCount() { return failedCount; }
    public void setFailedCount(int failedCount) { this.failedCount = failedCount; }

    public OffsetDateTime getLastAttemptAt() { return lastAttemptAt; }
    public void setLastAttemptAt(OffsetDateTime lastAttemptAt) { this.lastAttemptAt = lastAttemptAt; }

    public OffsetDateTime getLockoutUntil() { return lockoutUntil; }
    public void setLockoutUntil(OffsetDateTime lockoutUntil) { this.lockoutUntil = lockoutUntil; }
}
