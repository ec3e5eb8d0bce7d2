package com.securepower.antitheft.domain.alert;

public enum AlertType {
    UNAUTHORIZED_POWEROFF(true, "Unauthorized power-off attempt"),
    SIM_CHANGED(true, "SIM card changed"),
    FAILED_AUTH_THRESHOLD(true, "Multiple failed authentication attempts"),
    APP_UNINSTALL_ATTEMPT(false, "App uninstall attempt"),
    DEVICE_ADMIN_REMOVED(false, "Device admin removed");

    private final boolean critical;
    private final String description;

    AlertType(boolean critical, String description) {
        this.critical = critical;
        this.description = description;
    }

    /**
     * Critical alerts go out on every channel; the rest are push-only.
     */
    public boolean isCritical() {
        return critical;
    }

    public String getDescription() {
        return description;
    }
}
