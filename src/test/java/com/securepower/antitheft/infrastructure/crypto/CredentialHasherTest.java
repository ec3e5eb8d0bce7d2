package com.securepower.antitheft.infrastructure.crypto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialHasherTest {

    private final CredentialHasher hasher = new CredentialHasher();

    @Test
    void shouldDeriveSameHashForSameSalt() {
        byte[] salt = hasher.newSalt();

        byte[] first = hasher.derive("1234", salt, CredentialHasher.ITERATIONS);
        byte[] second = hasher.derive("1234", salt, CredentialHasher.ITERATIONS);

        assertThat(first).hasSize(CredentialHasher.KEY_LENGTH_BITS / 8).isEqualTo(second);
    }

    @Test
    void shouldDeriveDifferentHashesForDifferentSalts() {
        byte[] a = hasher.derive("1234", hasher.newSalt(), CredentialHasher.ITERATIONS);
        byte[] b = hasher.derive("1234", hasher.newSalt(), CredentialHasher.ITERATIONS);

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void shouldMatchOnlyTheOriginalCredential() {
        byte[] salt = hasher.newSalt();
        byte[] hash = hasher.derive("correct horse", salt, CredentialHasher.ITERATIONS);

        assertThat(hasher.matches("correct horse", salt, CredentialHasher.ITERATIONS, hash)).isTrue();
        assertThat(hasher.matches("correct hors", salt, CredentialHasher.ITERATIONS, hash)).isFalse();
        assertThat(hasher.matches("correct horse", salt, 1_000, hash)).isFalse();
    }

    @Test
    void shouldGenerateFreshSalts() {
        assertThat(hasher.newSalt()).hasSize(CredentialHasher.SALT_LENGTH).isNotEqualTo(hasher.newSalt());
    }
}
