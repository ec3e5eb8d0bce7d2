// ==============================================================================
// Credential Hashing Service
// File: src/main/java/com/securepower/antitheft/infrastructure/crypto/CredentialHasher.java
// ==============================================================================

package com.securepower.antitheft.infrastructure.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;

@Service
public class CredentialHasher {

    private static final Logger log = LoggerFactory.getLogger(CredentialHasher.class);

    // PBKDF2 configuration
    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    public static final int ITERATIONS = 100_000;
    public static final int KEY_LENGTH_BITS = 256;
    public static final int SALT_LENGTH = 32;

    private final SecureRandom secureRandom;

    public CredentialHasher() {
        this.secureRandom = new SecureRandom();
        log.info("✅ Credential hashing initialized - Algorithm: {}, Iterations: {}, KeyLength: {} bits",
                ALGORITHM, ITERATIONS, KEY_LENGTH_BITS);
    }

    public byte[] newSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        secureRandom.nextBytes(salt);
        return salt;
    }

    /**
     * Derive a hash of the raw credential. Deterministic for the same credential, salt and iterations.
     */
    public byte[] derive(String rawCredential, byte[] salt, int iterations) {
        char[] chars = rawCredential.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(chars, salt, iterations, KEY_LENGTH_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(ALGORITHM);
            return factory.generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            log.error("❌ Credential derivation failed: {}", e.getMessage(), e);
            throw new HashingException("Failed to derive credential hash", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(chars, '\0');
        }
    }

    /**
     * Compares over the full length regardless of where the first difference is.
     */
    public boolean matches(String rawCredential, byte[] salt, int iterations, byte[] expectedHash) {
        byte[] candidate = derive(rawCredential, salt, iterations);
        return MessageDigest.isEqual(candidate, expectedHash);
    }

    public static class HashingException extends RuntimeException {
        public HashingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
