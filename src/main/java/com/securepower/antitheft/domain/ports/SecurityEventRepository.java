package com.securepower.antitheft.domain.ports;

import com.securepower.antitheft.domain.alert.SecurityEvent;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SecurityEventRepository {

    /**
     * Stores the event unless one with the same id exists.
     *
     * @return the stored event, which is the existing one on redelivery
     */
    SecurityEvent saveIfAbsent(SecurityEvent event);

    Optional<SecurityEvent> findById(UUID eventId);

    void save(SecurityEvent event);

    List<SecurityEvent> findByDevice(String deviceId);
}
