package com.securepower.antitheft.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SpringDeviceRepository extends JpaRepository<DeviceEntity, String> {
}
