package com.securepower.antitheft.infrastructure.adapters;

import com.securepower.antitheft.domain.credential.AttemptState;
import com.securepower.antitheft.domain.ports.AttemptStateRepository;
import com.securepower.antitheft.infrastructure.jpa.AttemptStateEntity;
import com.securepower.antitheft.infrastructure.jpa.SpringAttemptStateRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.fromColumn;
import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.toColumn;

@Component
public class JpaAttemptStateRepositoryAdapter implements AttemptStateRepository {
    private final SpringAttemptStateRepository attempts;

    public JpaAttemptStateRepositoryAdapter(SpringAttemptStateRepository attempts) {
        this.attempts = attempts;
    }

    @Override
    public Optional<AttemptState> find(String deviceId) {
        return attempts.findById(deviceId)
                .map(e -> new AttemptState(e.getDeviceId(), e.getFailedCount(),
                        fromColumn(e.getLastAttemptAt()), fromColumn(e.getLockoutUntil())));
    }

    @Override
    @Transactional
    public void save(AttemptState state) {
        AttemptStateEntity e = new AttemptStateEntity();
        e.setDeviceId(state.getDeviceId());
        e.setFailedCount(state.getFailedCount());
        e.setLastAttemptAt(toColumn(state.getLastAttemptAt()));
        e.setLockoutUntil(toColumn(state.getLockoutUntil()));
        attempts.save(e);
    }
}
