package com.securepower.antitheft.domain.ports;

import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.device.DeviceRecord;
import com.securepower.antitheft.domain.tracking.LocationPoint;

import java.time.Instant;
import java.util.Optional;

public interface DeviceRepository {
    Optional<DeviceRecord> findById(String deviceId);
    DeviceRecord save(DeviceRecord device);
    void markUnderAlert(String deviceId, AlertType type, Instant at);
    void markActive(String deviceId);
    void updateLastLocation(String deviceId, LocationPoint location);
}
