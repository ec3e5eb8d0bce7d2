package com.securepower.antitheft.domain.alert;

import java.time.Instant;

/**
 * Audit record of one channel attempt for one event. Exactly one of
 * {@code sent}, {@code skippedReason} or {@code error} describes the result.
 */
public record NotificationOutcome(
        ChannelType channel,
        boolean sent,
        Instant sentAt,
        String skippedReason,
        String error
) {
    public static final String SKIP_RATE_LIMIT = "rate_limit";
    public static final String SKIP_DISABLED_BY_USER = "disabled_by_user";
    public static final String SKIP_NO_RECIPIENT = "no_recipient";
    public static final String ERROR_TIMEOUT = "timeout";

    public static NotificationOutcome sent(ChannelType channel, Instant sentAt) {
        return new NotificationOutcome(channel, true, sentAt, null, null);
    }

    public static NotificationOutcome skipped(ChannelType channel, String reason) {
        return new NotificationOutcome(channel, false, null, reason, null);
    }

    public static NotificationOutcome error(ChannelType channel, String error) {
        return new NotificationOutcome(channel, false, null, null, error);
    }

    public boolean isSkipped() {
        return skippedReason != null;
    }

    public boolean isError() {
        return error != null;
    }
}
