package com.securepower.antitheft.domain.credential;

/**
 * Result of a credential check. One record per state-machine branch.
 */
public sealed interface AuthOutcome
        permits AuthOutcome.Success, AuthOutcome.NotConfigured, AuthOutcome.Failed,
                AuthOutcome.FailedAtThreshold, AuthOutcome.FailedWithAlert, AuthOutcome.LockedOut {

    String status();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success() implements AuthOutcome {
        public String status() { return "SUCCESS"; }
    }

    record NotConfigured() implements AuthOutcome {
        public String status() { return "NOT_CONFIGURED"; }
    }

    record Failed(int attemptCount) implements AuthOutcome {
        public String status() { return "FAILED"; }
    }

    /**
     * The next failure escalates.
     */
    record FailedAtThreshold(int attemptCount) implements AuthOutcome {
        public String status() { return "FAILED_AT_THRESHOLD"; }
    }

    record FailedWithAlert(int attemptCount, long lockoutSeconds) implements AuthOutcome {
        public String status() { return "FAILED_WITH_ALERT"; }
    }

    record LockedOut(long remainingSeconds) implements AuthOutcome {
        public String status() { return "LOCKED_OUT"; }
    }
}
