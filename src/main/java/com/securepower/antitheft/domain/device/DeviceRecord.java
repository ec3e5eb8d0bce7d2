package com.securepower.antitheft.domain.device;

import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.tracking.LocationPoint;

import java.time.Instant;

/**
 * A protected device and its status projection.
 */
public class DeviceRecord {
    private final String deviceId;
    private final String userId;
    private final String deviceName;
    private final String model;
    private final DeviceStatus status;
    private final Instant lastAlert;
    private final AlertType lastAlertType;
    private final LocationPoint lastLocation;

    public DeviceRecord(String deviceId, String userId, String deviceName, String model, DeviceStatus status,
                        Instant lastAlert, AlertType lastAlertType, LocationPoint lastLocation) {
        this.deviceId = deviceId;
        this.userId = userId;
        this.deviceName = deviceName;
        this.model = model;
        this.status = status;
        this.lastAlert = lastAlert;
        this.lastAlertType = lastAlertType;
        this.lastLocation = lastLocation;
    }

    public String getDeviceId() { return deviceId; }
    public String getUserId() { return userId; }
    public String getDeviceName() { return deviceName; }
    public String getModel() { return model; }
    public DeviceStatus getStatus() { return status; }
    public Instant getLastAlert() { return lastAlert; }
    public AlertType getLastAlertType() { return lastAlertType; }
    public LocationPoint getLastLocation() { return lastLocation; }

    public boolean isUnderAlert() {
        return status == DeviceStatus.SECURITY_ALERT;
    }
}
