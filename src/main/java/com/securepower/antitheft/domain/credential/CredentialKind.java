package com.securepower.antitheft.domain.credential;

/**
 * The two credential forms a device owner can configure to authorize a power-off.
 */
public enum CredentialKind {
    /**
     * 4 to 6 decimal digits
     */
    PIN {
        @Override
        public boolean accepts(String raw) {
            return raw != null && raw.length() >= 4 && raw.length() <= 6
                    && raw.chars().allMatch(c -> c >= '0' && c <= '9');
        }
    },

    /**
     * Backup password, at least 8 characters
     */
    PASSWORD {
        @Override
        public boolean accepts(String raw) {
            return raw != null && raw.length() >= 8;
        }
    };

    public abstract boolean accepts(String raw);

    public CredentialKind other() {
        return this == PIN ? PASSWORD : PIN;
    }
}
