package com.securepower.antitheft.domain.device;

public enum DeviceStatus {
    ACTIVE,
    SECURITY_ALERT
}
