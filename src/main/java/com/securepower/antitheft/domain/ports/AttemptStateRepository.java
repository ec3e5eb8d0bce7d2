package com.securepower.antitheft.domain.ports;

import com.securepower.antitheft.domain.credential.AttemptState;

import java.util.Optional;

public interface AttemptStateRepository {
    Optional<AttemptState> find(String deviceId);
    void save(AttemptState state);
}
