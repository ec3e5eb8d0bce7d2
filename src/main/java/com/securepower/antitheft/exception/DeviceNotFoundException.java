package com.securepower.antitheft.exception;

public class DeviceNotFoundException extends RuntimeException {

    public DeviceNotFoundException(String deviceId) {
        super("Device not registered: " + deviceId);
    }
}
