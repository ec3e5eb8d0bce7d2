package com.securepower.antitheft.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringLocationPointRepository extends JpaRepository<LocationPointEntity, UUID> {
    List<LocationPointEntity> findBySessionIdOrderByRecordedAtAsc(String sessionId);

    Optional<LocationPointEntity> findBySessionIdAndRecordedAt(String sessionId, OffsetDateTime recordedAt);

    @Modifying
    @Query("delete from LocationPointEntity l where l.sessionId = :sessionId and l.recordedAt in :recordedAt")
    int deleteBySessionIdAndRecordedAtIn(@Param("sessionId") String sessionId,
                                         @Param("recordedAt") Collection<OffsetDateTime> recordedAt);
}
