package com.securepower.antitheft.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;

@Entity
@Table(name = "user_profiles")
public class UserProfileEntity {

    @Id
    @Column(name = "user_id", length = 128)
    private String userId;

    @Column(length = 200)
    private String name;

    @Column(name = "trusted_number", length = 32)
    private String trustedNumber;

    @Column(name = "family_emails_json", columnDefinition = "TEXT")
    private String familyEmailsJson;

    @Column(name = "push_tokens_json", columnDefinition = "TEXT")
    private String pushTokensJson;

    @Column(name = "settings_json", columnDefinition = "TEXT")
    private String settingsJson;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public UserProfileEntity() {}

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getTrustedNumber() { return trustedNumber; }
    public void setTrustedNumber(String trustedNumber) { this.trustedNumber = trustedNumber; }

    public String getFamilyEmailsJson() { return familyEmailsJson; }
    public void setFamilyEmailsJson(String familyEmailsJson) { this.familyEmailsJson = familyEmailsJson; }

    public String getPushTokensJson() { return pushTokensJson; }
    public void setPushTokensJson(String pushTokensJson) { this.pushTokensJson = pushTokensJson; }

    public String getSettingsJson() { return settingsJson; }
    public void setSettingsJson(String settingsJson) { this.settingsJson = settingsJson; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }
}
