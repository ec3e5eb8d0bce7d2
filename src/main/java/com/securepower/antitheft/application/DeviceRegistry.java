package com.securepower.antitheft.application;

import com.securepower.antitheft.domain.alert.UserProfile;
import com.securepower.antitheft.domain.device.DeviceRecord;
import com.securepower.antitheft.domain.device.DeviceStatus;
import com.securepower.antitheft.domain.ports.DeviceRepository;
import com.securepower.antitheft.domain.ports.UserProfileRepository;
import com.securepower.antitheft.exception.DeviceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Devices and the contact profiles of their owners.
 */
@Service
public class DeviceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

    private final DeviceRepository devices;
    private final UserProfileRepository users;

    public DeviceRegistry(DeviceRepository devices, UserProfileRepository users) {
        this.devices = devices;
        this.users = users;
    }

    /**
     * Registers a device, or renames an already registered one. Status and last-alert data of
     * an existing device are kept.
     */
    public DeviceRecord register(String deviceId, String userId, String deviceName, String model) {
        Optional<DeviceRecord> existing = devices.findById(deviceId);
        DeviceRecord record = existing
                .map(d -> new DeviceRecord(deviceId, userId, deviceName, model, d.getStatus(),
                        d.getLastAlert(), d.getLastAlertType(), d.getLastLocation()))
                .orElseGet(() -> new DeviceRecord(deviceId, userId, deviceName, model, DeviceStatus.ACTIVE,
                        null, null, null));

        DeviceRecord saved = devices.save(record);
        log.info("📱 Device {} {} for user {}", deviceId, existing.isPresent() ? "updated" : "registered", userId);
        return saved;
    }

    public DeviceRecord get(String deviceId) {
        return devices.findById(deviceId).orElseThrow(() -> new DeviceNotFoundException(deviceId));
    }

    public UserProfile saveProfile(UserProfile profile) {
        UserProfile saved = users.save(profile);
        log.info("👤 Contact profile saved for user {} - emails: {}, push tokens: {}",
                profile.getUserId(), profile.getFamilyEmails().size(), profile.getPushTokens().size());
        return saved;
    }

    public Optional<UserProfile> findProfile(String userId) {
        return users.findById(userId);
    }
}
