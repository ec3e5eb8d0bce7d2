package com.securepower.antitheft.application;

import com.securepower.antitheft.domain.credential.AttemptState;
import com.securepower.antitheft.domain.credential.CredentialKind;
import com.securepower.antitheft.domain.credential.StoredCredential;
import com.securepower.antitheft.domain.ports.AttemptStateRepository;
import com.securepower.antitheft.domain.ports.CredentialRepository;
import com.securepower.antitheft.exception.CredentialAlreadyConfiguredException;
import com.securepower.antitheft.exception.DeviceLockedOutException;
import com.securepower.antitheft.exception.InvalidCredentialFormatException;
import com.securepower.antitheft.infrastructure.crypto.CredentialHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * Salted, iterated hashes of each device's PIN and password. The raw value is never stored
 * or logged.
 */
@Service
public class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    private final CredentialRepository credentials;
    private final AttemptStateRepository attempts;
    private final CredentialHasher hasher;
    private final Clock clock;

    public CredentialStore(CredentialRepository credentials, AttemptStateRepository attempts,
                           CredentialHasher hasher, Clock clock) {
        this.credentials = credentials;
        this.attempts = attempts;
        this.hasher = hasher;
        this.clock = clock;
    }

    /**
     * First-time setup. Once the device holds any credential, changes go through
     * {@link AuthGate#changeCredential} so that an existing credential is verified first.
     *
     * @throws InvalidCredentialFormatException when the value does not satisfy the kind's format
     * @throws DeviceLockedOutException while the device's verification lockout runs
     * @throws CredentialAlreadyConfiguredException when a PIN or password is already stored
     */
    public void setup(String deviceId, CredentialKind kind, String rawCredential) {
        requireFormat(deviceId, kind, rawCredential);

        Instant now = clock.instant();
        Optional<AttemptState> state = attempts.find(deviceId);
        if (state.isPresent() && state.get().isLockedOut(now)) {
            log.warn("🔒 Refused {} setup for device {}: locked out", kind, deviceId);
            throw new DeviceLockedOutException(deviceId, state.get().remainingLockoutSeconds(now));
        }
        if (isConfigured(deviceId, CredentialKind.PIN) || isConfigured(deviceId, CredentialKind.PASSWORD)) {
            log.warn("⚠️ Refused {} setup for device {}: credentials already configured", kind, deviceId);
            throw new CredentialAlreadyConfiguredException(deviceId);
        }

        store(deviceId, kind, rawCredential);
    }

    /**
     * @return false when the value does not match or no credential of that kind exists
     */
    public boolean verify(String deviceId, CredentialKind kind, String rawCredential) {
        if (rawCredential == null) {
            return false;
        }
        return credentials.find(deviceId, kind)
                .map(stored -> hasher.matches(rawCredential, stored.getSalt(), stored.getIterations(), stored.getHash()))
                .orElse(false);
    }

    public boolean isConfigured(String deviceId, CredentialKind kind) {
        return credentials.find(deviceId, kind).isPresent();
    }

    void requireFormat(String deviceId, CredentialKind kind, String rawCredential) {
        if (!kind.accepts(rawCredential)) {
            log.warn("⚠️ Rejected {} setup for device {}: invalid format", kind, deviceId);
            throw new InvalidCredentialFormatException(kind);
        }
    }

    // Unguarded write; callers have already authorized the change
    void store(String deviceId, CredentialKind kind, String rawCredential) {
        requireFormat(deviceId, kind, rawCredential);

        byte[] salt = freshSalt(deviceId, kind);
        byte[] hash = hasher.derive(rawCredential, salt, CredentialHasher.ITERATIONS);
        credentials.save(new StoredCredential(deviceId, kind, salt, hash, CredentialHasher.ITERATIONS, clock.instant()));

        log.info("✅ {} configured for device {}", kind, deviceId);
    }

    /**
     * Removes both credentials. The attempt state is left as it is.
     */
    void clear(String deviceId) {
        credentials.deleteAll(deviceId);
        log.info("🗑️ Credentials removed for device {}", deviceId);
    }

    // PIN and password of one device never share a salt
    private byte[] freshSalt(String deviceId, CredentialKind kind) {
        Optional<StoredCredential> other = credentials.find(deviceId, kind.other());
        byte[] salt = hasher.newSalt();
        while (other.isPresent() && Arrays.equals(salt, other.get().getSalt())) {
            salt = hasher.newSalt();
        }
        return salt;
    }
}
