package com.securepower.antitheft.infrastructure.jpa;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Timestamps are stored as UTC offset date-times.
 */
public final class TimeColumns {

    private TimeColumns() {
    }

    public static OffsetDateTime toColumn(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    public static Instant fromColumn(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
