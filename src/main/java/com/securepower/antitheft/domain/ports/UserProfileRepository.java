package com.securepower.antitheft.domain.ports;

import com.securepower.antitheft.domain.alert.UserProfile;

import java.util.Optional;

public interface UserProfileRepository {
    Optional<UserProfile> findById(String userId);
    UserProfile save(UserProfile profile);
}
