package com.securepower.antitheft.domain.alert;

import java.util.Locale;

/**
 * Outbound notification channels. Critical-only channels are reserved for
 * {@link AlertType#isCritical() critical} alerts.
 */
public enum ChannelType {
    SMS(true),
    EMAIL(true),
    PUSH(false);

    private final boolean criticalOnly;

    ChannelType(boolean criticalOnly) {
        this.criticalOnly = criticalOnly;
    }

    public boolean isEligibleFor(AlertType type) {
        return !criticalOnly || type.isCritical();
    }

    /**
     * Key of this channel in a user's settings map, e.g. {@code sms} or {@code sms.SIM_CHANGED}.
     */
    public String settingsKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String settingsKey(AlertType type) {
        return settingsKey() + "." + type.name();
    }
}
