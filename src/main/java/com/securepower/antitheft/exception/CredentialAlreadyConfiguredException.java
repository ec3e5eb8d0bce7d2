package com.securepower.antitheft.exception;

/**
 * Exception thrown when a first-time credential setup is attempted on a device that already has
 * a PIN or password. Changing credentials then requires verifying an existing one.
 */
public class CredentialAlreadyConfiguredException extends RuntimeException {

    private final String deviceId;

    /**
     * Constructs a new credential already configured exception for the given device.
     *
     * @param deviceId the device that already holds a credential
     */
    public CredentialAlreadyConfiguredException(String deviceId) {
        super("Device " + deviceId + " already has a credential; verify it to make changes");
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
