package com.securepower.antitheft.domain.ports;

import com.securepower.antitheft.domain.credential.CredentialKind;
import com.securepower.antitheft.domain.credential.StoredCredential;

import java.util.Optional;

public interface CredentialRepository {
    Optional<StoredCredential> find(String deviceId, CredentialKind kind);
    void save(StoredCredential credential);
    void deleteAll(String deviceId);
}
