package com.securepower.antitheft.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SpringAttemptStateRepository extends JpaRepository<AttemptStateEntity, String> {
}
