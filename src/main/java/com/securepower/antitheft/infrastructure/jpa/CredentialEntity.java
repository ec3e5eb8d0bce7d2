package com.securepower.antitheft.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;

@Entity
@Table(name = "device_credentials",
        uniqueConstraints = @UniqueConstraint(columnNames = {"device_id", "kind"}))
public class CredentialEntity {

    // "<deviceId>:<kind>"
    @Id
    @Column(length = 200)
    private String id;

    @Column(name = "device_id", nullable = false, length = 128)
    private String deviceId;

    @Column(nullable = false, length = 20)
    private String kind;

    @Column(name = "salt_b64", nullable = false, length = 64)
    private String salt;

    @Column(name = "hash_b64", nullable = false, length = 64)
    private String hash;

    @Column(nullable = false)
    private int iterations;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public CredentialEntity() {}

    public static String idFor(String deviceId, String kind) {
        return deviceId + ":" + kind;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public String getSalt() { return salt; }
    public void setSalt(String salt) { this.salt = salt; }

    public String getHash() { return hash; }
    public void setHash(String hash) { this.hash = hash; }

    public int getIterations() { return iterations; }
    public void setIterations(int iterations) { this.iterations = iterations; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }
}
