package com.securepower.antitheft.exception;

import com.securepower.antitheft.domain.credential.CredentialKind;

/**
 * Exception thrown when a credential submitted for setup does not meet the format rules of its kind.
 * Nothing is stored when this is thrown.
 */
public class InvalidCredentialFormatException extends RuntimeException {

    private final CredentialKind kind;

    /**
     * Constructs a new invalid credential format exception for the given kind.
     *
     * @param kind the credential kind whose format rules were violated
     */
    public InvalidCredentialFormatException(CredentialKind kind) {
        super(describe(kind));
        this.kind = kind;
    }

    /**
     * @return the credential kind whose format rules were violated
     */
    public CredentialKind getKind() {
        return kind;
    }

    private static String describe(CredentialKind kind) {
        return switch (kind) {
            case PIN -> "PIN must be 4 to 6 digits";
            case PASSWORD -> "Password must be at least 8 characters";
        };
    }
}
