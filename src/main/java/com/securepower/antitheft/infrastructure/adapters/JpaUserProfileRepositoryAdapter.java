package com.securepower.antitheft.infrastructure.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securepower.antitheft.domain.alert.UserProfile;
import com.securepower.antitheft.domain.ports.UserProfileRepository;
import com.securepower.antitheft.infrastructure.jpa.SpringUserProfileRepository;
import com.securepower.antitheft.infrastructure.jpa.UserProfileEntity;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class JpaUserProfileRepositoryAdapter implements UserProfileRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Boolean>> SETTINGS = new TypeReference<>() {};

    private final SpringUserProfileRepository users;
    private final ObjectMapper objectMapper;

    public JpaUserProfileRepositoryAdapter(SpringUserProfileRepository users, ObjectMapper objectMapper) {
        this.users = users;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<UserProfile> findById(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return users.findById(userId).map(e -> new UserProfile(
                e.getUserId(),
                e.getName(),
                e.getTrustedNumber(),
                read(e.getFamilyEmailsJson(), STRING_LIST),
                read(e.getPushTokensJson(), STRING_LIST),
                read(e.getSettingsJson(), SETTINGS)));
    }

    @Override
    @Transactional
    public UserProfile save(UserProfile profile) {
        UserProfileEntity e = new UserProfileEntity();
        e.setUserId(profile.getUserId());
        e.setName(profile.getName());
        e.setTrustedNumber(profile.getTrustedNumber());
        e.setFamilyEmailsJson(write(profile.getFamilyEmails()));
        e.setPushTokensJson(write(profile.getPushTokens()));
        e.setSettingsJson(write(profile.getSettings()));
        e.setUpdatedAt(OffsetDateTime.now());
        users.save(e);
        return profile;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize user profile", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read user profile", e);
        }
    }
}
