package com.securepower.antitheft.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface SpringCredentialRepository extends JpaRepository<CredentialEntity, String> {
    Optional<CredentialEntity> findByDeviceIdAndKind(String deviceId, String kind);

    @Modifying
    @Query("delete from CredentialEntity c where c.deviceId = :deviceId")
    int deleteByDeviceId(@Param("deviceId") String deviceId);
}
