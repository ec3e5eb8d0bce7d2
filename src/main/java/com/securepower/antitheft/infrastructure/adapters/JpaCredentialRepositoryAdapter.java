package com.securepower.antitheft.infrastructure.adapters;

import com.securepower.antitheft.domain.credential.CredentialKind;
import com.securepower.antitheft.domain.credential.StoredCredential;
import com.securepower.antitheft.domain.ports.CredentialRepository;
import com.securepower.antitheft.infrastructure.jpa.CredentialEntity;
import com.securepower.antitheft.infrastructure.jpa.SpringCredentialRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Base64;
import java.util.Optional;

import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.fromColumn;
import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.toColumn;

@Component
public class JpaCredentialRepositoryAdapter implements CredentialRepository {
    private final SpringCredentialRepository credentials;

    public JpaCredentialRepositoryAdapter(SpringCredentialRepository credentials) {
        this.credentials = credentials;
    }

    @Override
    public Optional<StoredCredential> find(String deviceId, CredentialKind kind) {
        return credentials.findByDeviceIdAndKind(deviceId, kind.name())
                .map(e -> new StoredCredential(
                        e.getDeviceId(),
                        CredentialKind.valueOf(e.getKind()),
                        Base64.getDecoder().decode(e.getSalt()),
                        Base64.getDecoder().decode(e.getHash()),
                        e.getIterations(),
                        fromColumn(e.getCreatedAt())));
    }

    @Override
    @Transactional
    public void save(StoredCredential c) {
        CredentialEntity e = new CredentialEntity();
        e.setId(CredentialEntity.idFor(c.getDeviceId(), c.getKind().name()));
        e.setDeviceId(c.getDeviceId());
        e.setKind(c.getKind().name());
        e.setSalt(Base64.getEncoder().encodeToString(c.getSalt()));
        e.setHash(Base64.getEncoder().encodeToString(c.getHash()));
        e.setIterations(c.getIterations());
        e.setCreatedAt(toColumn(c.getCreatedAt()));
        credentials.save(e);
    }

    @Override
    @Transactional
    public void deleteAll(String deviceId) {
        credentials.deleteByDeviceId(deviceId);
    }
}
