package com.securepower.antitheft.domain.tracking;

public enum CloseReason {
    /**
     * Closed by the expiry sweep once the session outlived its maximum age
     */
    AGE_LIMIT,

    /**
     * Closed explicitly by the device owner
     */
    OWNER_CLOSED
}
