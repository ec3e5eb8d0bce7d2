package com.securepower.antitheft.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface SpringTrackingSessionRepository extends JpaRepository<TrackingSessionEntity, String> {
    Optional<TrackingSessionEntity> findFirstByDeviceIdAndActiveTrueOrderByStartTimeDesc(String deviceId);

    @Query("select s.sessionId from TrackingSessionEntity s where s.active = true")
    List<String> findActiveSessionIds();
}
