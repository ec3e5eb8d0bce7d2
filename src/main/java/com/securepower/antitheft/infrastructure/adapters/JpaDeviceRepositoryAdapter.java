package com.securepower.antitheft.infrastructure.adapters;

import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.device.DeviceRecord;
import com.securepower.antitheft.domain.device.DeviceStatus;
import com.securepower.antitheft.domain.ports.DeviceRepository;
import com.securepower.antitheft.domain.tracking.LocationPoint;
import com.securepower.antitheft.exception.DeviceNotFoundException;
import com.securepower.antitheft.infrastructure.jpa.DeviceEntity;
import com.securepower.antitheft.infrastructure.jpa.SpringDeviceRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.fromColumn;
import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.toColumn;

@Component
public class JpaDeviceRepositoryAdapter implements DeviceRepository {
    private final SpringDeviceRepository devices;

    public JpaDeviceRepositoryAdapter(SpringDeviceRepository devices) {
        this.devices = devices;
    }

    @Override
    public Optional<DeviceRecord> findById(String deviceId) {
        return devices.findById(deviceId).map(this::toDomain);
    }

    @Override
    @Transactional
    public DeviceRecord save(DeviceRecord d) {
        DeviceEntity e = devices.findById(d.getDeviceId()).orElseGet(DeviceEntity::new);
        e.setDeviceId(d.getDeviceId());
        e.setUserId(d.getUserId());
        e.setDeviceName(d.getDeviceName());
        e.setModel(d.getModel());
        e.setStatus(d.getStatus().name());
        e.setLastAlert(toColumn(d.getLastAlert()));
        e.setLastAlertType(d.getLastAlertType() != null ? d.getLastAlertType().name() : null);
        applyLocation(e, d.getLastLocation());
        devices.save(e);
        return d;
    }

    @Override
    @Transactional
    public void markUnderAlert(String deviceId, AlertType type, Instant at) {
        DeviceEntity e = load(deviceId);
        e.setStatus(DeviceStatus.SECURITY_ALERT.name());
        e.setLastAlert(toColumn(at));
        e.setLastAlertType(type.name());
        devices.save(e);
    }

    @Override
    @Transactional
    public void markActive(String deviceId) {
        devices.findById(deviceId).ifPresent(e -> {
            e.setStatus(DeviceStatus.ACTIVE.name());
            devices.save(e);
        });
    }

    @Override
    @Transactional
    public void updateLastLocation(String deviceId, LocationPoint location) {
        devices.findById(deviceId).ifPresent(e -> {
            applyLocation(e, location);
            devices.save(e);
        });
    }

    private DeviceEntity load(String deviceId) {
        return devices.findById(deviceId).orElseThrow(() -> new DeviceNotFoundException(deviceId));
    }

    private void applyLocation(DeviceEntity e, LocationPoint location) {
        if (location == null) {
            return;
        }
        e.setLastLatitude(location.lat());
        e.setLastLongitude(location.lng());
        e.setLastAccuracy(location.accuracy());
        e.setLastLocationAt(toColumn(location.timestamp()));
        e.setLastAddress(location.address());
    }

    private DeviceRecord toDomain(DeviceEntity e) {
        LocationPoint lastLocation = null;
        if (e.getLastLatitude() != null && e.getLastLongitude() != null && e.getLastLocationAt() != null) {
            lastLocation = LocationPoint.of(e.getLastLatitude(), e.getLastLongitude(),
                            e.getLastAccuracy() != null ? e.getLastAccuracy() : 0.0, fromColumn(e.getLastLocationAt()))
                    .withAddress(e.getLastAddress());
        }
        return new DeviceRecord(
                e.getDeviceId(),
                e.getUserId(),
                e.getDeviceName(),
                e.getModel(),
                DeviceStatus.valueOf(e.getStatus()),
                fromColumn(e.getLastAlert()),
                e.getLastAlertType() != null ? AlertType.valueOf(e.getLastAlertType()) : null,
                lastLocation);
    }
}
