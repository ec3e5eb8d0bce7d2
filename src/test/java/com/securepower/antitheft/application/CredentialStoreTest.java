package com.securepower.antitheft.application;

import com.securepower.antitheft.domain.credential.AttemptState;
import com.securepower.antitheft.domain.credential.CredentialKind;
import com.securepower.antitheft.domain.credential.StoredCredential;
import com.securepower.antitheft.exception.CredentialAlreadyConfiguredException;
import com.securepower.antitheft.exception.DeviceLockedOutException;
import com.securepower.antitheft.exception.InvalidCredentialFormatException;
import com.securepower.antitheft.infrastructure.crypto.CredentialHasher;
import com.securepower.antitheft.support.InMemoryStores;
import com.securepower.antitheft.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialStoreTest {

    private static final String DEVICE = "device-1";

    private InMemoryStores.Credentials credentials;
    private InMemoryStores.Attempts attempts;
    private CredentialStore store;

    @BeforeEach
    void setUp() {
        credentials = new InMemoryStores.Credentials();
        attempts = new InMemoryStores.Attempts();
        store = new CredentialStore(credentials, attempts, new CredentialHasher(),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
    }

    @Test
    void shouldVerifyConfiguredPin() {
        store.setup(DEVICE, CredentialKind.PIN, "1234");

        assertThat(store.isConfigured(DEVICE, CredentialKind.PIN)).isTrue();
        assertThat(store.isConfigured(DEVICE, CredentialKind.PASSWORD)).isFalse();
        assertThat(store.verify(DEVICE, CredentialKind.PIN, "1234")).isTrue();
        assertThat(store.verify(DEVICE, CredentialKind.PIN, "4321")).isFalse();
        assertThat(store.verify(DEVICE, CredentialKind.PIN, null)).isFalse();
    }

    @Test
    void shouldNeverStoreTheRawValue() {
        store.setup(DEVICE, CredentialKind.PASSWORD, "hunter2-hunter2");

        StoredCredential stored = credentials.find(DEVICE, CredentialKind.PASSWORD).orElseThrow();
        assertThat(stored.getIterations()).isEqualTo(CredentialHasher.ITERATIONS);
        assertThat(new String(stored.getHash())).doesNotContain("hunter2");
    }

    @Test
    void shouldRejectMalformedCredentials() {
        assertThatThrownBy(() -> store.setup(DEVICE, CredentialKind.PIN, "12a4"))
                .isInstanceOf(InvalidCredentialFormatException.class);
        assertThatThrownBy(() -> store.setup(DEVICE, CredentialKind.PIN, "123"))
                .isInstanceOf(InvalidCredentialFormatException.class);
        assertThatThrownBy(() -> store.setup(DEVICE, CredentialKind.PIN, "1234567"))
                .isInstanceOf(InvalidCredentialFormatException.class);
        assertThatThrownBy(() -> store.setup(DEVICE, CredentialKind.PASSWORD, "short"))
                .isInstanceOf(InvalidCredentialFormatException.class);

        assertThat(store.isConfigured(DEVICE, CredentialKind.PIN)).isFalse();
    }

    @Test
    void shouldRefuseSecondSetupOnceConfigured() {
        store.setup(DEVICE, CredentialKind.PIN, "1234");

        assertThatThrownBy(() -> store.setup(DEVICE, CredentialKind.PIN, "987654"))
                .isInstanceOf(CredentialAlreadyConfiguredException.class);
        assertThatThrownBy(() -> store.setup(DEVICE, CredentialKind.PASSWORD, "backup-password"))
                .isInstanceOf(CredentialAlreadyConfiguredException.class);

        assertThat(store.verify(DEVICE, CredentialKind.PIN, "1234")).isTrue();
        assertThat(store.isConfigured(DEVICE, CredentialKind.PASSWORD)).isFalse();
    }

    @Test
    void shouldRefuseSetupDuringLockout() {
        attempts.save(new AttemptState(DEVICE, 3, Instant.parse("2026-03-01T10:00:00Z"),
                Instant.parse("2026-03-01T10:00:30Z")));

        assertThatThrownBy(() -> store.setup(DEVICE, CredentialKind.PIN, "9999"))
                .isInstanceOf(DeviceLockedOutException.class)
                .satisfies(e -> assertThat(((DeviceLockedOutException) e).getRemainingSeconds()).isEqualTo(30));

        assertThat(store.isConfigured(DEVICE, CredentialKind.PIN)).isFalse();
    }

    @Test
    void shouldNotReuseSaltAcrossPinAndPassword() {
        byte[] shared = new byte[CredentialHasher.SALT_LENGTH];
        byte[] distinct = new byte[CredentialHasher.SALT_LENGTH];
        distinct[0] = 1;
        Deque<byte[]> salts = new ArrayDeque<>();
        salts.add(shared);
        salts.add(shared);
        salts.add(distinct);

        CredentialStore scripted = new CredentialStore(credentials, attempts, new CredentialHasher() {
            @Override
            public byte[] newSalt() {
                return salts.poll().clone();
            }
        }, new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));

        scripted.setup(DEVICE, CredentialKind.PIN, "1234");
        scripted.store(DEVICE, CredentialKind.PASSWORD, "backup-password");

        assertThat(credentials.find(DEVICE, CredentialKind.PASSWORD).orElseThrow().getSalt()).isEqualTo(distinct);
        assertThat(scripted.verify(DEVICE, CredentialKind.PASSWORD, "backup-password")).isTrue();
    }

    @Test
    void shouldKeepAttemptStateWhenCredentialsAreCleared() {
        store.setup(DEVICE, CredentialKind.PIN, "1234");
        store.store(DEVICE, CredentialKind.PASSWORD, "backup-password");
        attempts.save(new AttemptState(DEVICE, 2, Instant.parse("2026-03-01T09:59:00Z"), null));

        store.clear(DEVICE);

        assertThat(store.isConfigured(DEVICE, CredentialKind.PIN)).isFalse();
        assertThat(store.isConfigured(DEVICE, CredentialKind.PASSWORD)).isFalse();
        assertThat(attempts.find(DEVICE)).hasValueSatisfying(state -> assertThat(state.getFailedCount()).isEqualTo(2));
    }
}
