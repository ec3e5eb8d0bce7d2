package com.securepower.antitheft.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpringSecurityEventRepository extends JpaRepository<SecurityEventEntity, UUID> {
    List<SecurityEventEntity> findByDeviceIdOrderByOccurredAtDesc(String deviceId);
}
