package com.securepower.antitheft.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;

@Entity
@Table(name = "devices")
public class DeviceEntity {

    @Id
    @Column(name = "device_id", length = 128)
    private String deviceId;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "device_name", length = 200)
    private String deviceName;

    @Column(length = 200)
    private String model;

    @Column(nullable = false, length = 20)
    private String status;

    @Column(name = "last_alert")
    private OffsetDateTime lastAlert;

    @Column(name = "last_alert_type", length = 40)
    private String lastAlertType;

    // Last known location, flattened
    @Column(name = "last_latitude")
    private Double lastLatitude;

    @Column(name = "last_longitude")
    private Double lastLongitude;

    @Column(name = "last_accuracy")
    private Double lastAccuracy;

    @Column(name = "last_location_at")
    private OffsetDateTime lastLocationAt;

    @Column(name = "last_address", length = 500)
    private String lastAddress;

    public DeviceEntity() {}

    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getDeviceName() { return deviceName; }
    public void setDeviceName(String deviceName) { this.deviceName = deviceName; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public OffsetDateTime getLastAlert() { return lastAlert; }
    public void setLastAlert(OffsetDateTime lastAlert) { this.lastAlert = lastAlert; }

    public String getLastAlertType() { return lastAlertType; }
    public void setLastAlertType(String lastAlertType) { this.lastAlertType = lastAlertType; }

    public Double getLastLatitude() { return lastLatitude; }
    public void setLastLatitude(Double lastLatitude) { this.lastLatitude = lastLatitude; }

    public Double getLastLongitude() { return lastLongitude; }
    public void setLastLongitude(Double lastLongitude) { this.lastLongitude = lastLongitude; }

    public Double getLastAccuracy() { return lastAccuracy; }
    public void setLastAccuracy(Double lastAccuracy) { this.lastAccuracy = lastAccuracy; }

    public OffsetDateTime getLastLocationAt() { return lastLocationAt; }
    public void setLastLocationAt(OffsetDateTime lastLocationAt) { this.lastLocationAt = lastLocationAt; }

    public String getLastAddress() { return lastAddress; }
    public void setLastAddress(String lastAddress) { this.lastAddress = lastAddress; }
}
