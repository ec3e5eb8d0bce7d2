package com.securepower.antitheft.exception;

/**
 * Exception thrown when a credential change is attempted while the device's verification lockout
 * is still running.
 */
public class DeviceLockedOutException extends RuntimeException {

    private final String deviceId;
    private final long remainingSeconds;

    public DeviceLockedOutException(String deviceId, long remainingSeconds) {
        super("Device " + deviceId + " is locked out for another " + remainingSeconds + "s");
        this.deviceId = deviceId;
        this.remainingSeconds = remainingSeconds;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public long getRemainingSeconds() {
        return remainingSeconds;
    }
}
