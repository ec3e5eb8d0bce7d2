package com.securepower.antitheft.domain.credential;

import java.time.Instant;

/**
 * Salted derivation of a device credential. The raw credential is never kept.
 */
public class StoredCredential {
    private final String deviceId;
    private final CredentialKind kind;
    private final byte[] salt;
    private final byte[] hash;
    private final int iterations;
    private final Instant createdAt;

    public StoredCredential(String deviceId, CredentialKind kind, byte[] salt, byte[] hash,
                            int iterations, Instant createdAt) {
        this.deviceId = deviceId;
        this.kind = kind;
        this.salt = salt.clone();
        this.hash = hash.clone();
        this.iterations = iterations;
        this.createdAt = createdAt;
    }

    public String getDeviceId() { return deviceId; }
    public CredentialKind getKind() { return kind; }
    public byte[] getSalt() { return salt.clone(); }
    public byte[] getHash() { return hash.clone(); }
    public int getIterations() { return iterations; }
    public Instant getCreatedAt() { return createdAt; }
}
