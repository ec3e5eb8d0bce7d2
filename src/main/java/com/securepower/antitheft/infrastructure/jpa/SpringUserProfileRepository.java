package com.securepower.antitheft.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SpringUserProfileRepository extends JpaRepository<UserProfileEntity, String> {
}
