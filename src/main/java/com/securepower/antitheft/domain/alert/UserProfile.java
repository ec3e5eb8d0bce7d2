package com.securepower.antitheft.domain.alert;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Contact data of the trusted parties alerted on behalf of a device owner.
 */
public class UserProfile {
    private final String userId;
    private final String name;
    private final String trustedNumber;
    private final List<String> familyEmails;
    private final List<String> pushTokens;
    private final Map<String, Boolean> settings;

    public UserProfile(String userId, String name, String trustedNumber, List<String> familyEmails,
                       List<String> pushTokens, Map<String, Boolean> settings) {
        this.userId = userId;
        this.name = name;
        this.trustedNumber = trustedNumber;
        this.familyEmails = familyEmails != null ? List.copyOf(familyEmails) : List.of();
        this.pushTokens = pushTokens != null ? List.copyOf(pushTokens) : List.of();
        this.settings = settings != null ? Map.copyOf(settings) : Collections.emptyMap();
    }

    public String getUserId() { return userId; }
    public String getName() { return name; }
    public String getTrustedNumber() { return trustedNumber; }
    public List<String> getFamilyEmails() { return familyEmails; }
    public List<String> getPushTokens() { return pushTokens; }
    public Map<String, Boolean> getSettings() { return settings; }

    public List<String> recipientsFor(ChannelType channel) {
        return switch (channel) {
            case SMS -> trustedNumber == null || trustedNumber.isBlank() ? List.of() : List.of(trustedNumber);
            case EMAIL -> familyEmails;
            case PUSH -> pushTokens;
        };
    }

    /**
     * A channel is on unless the user switched it off globally or for this alert type.
     */
    public boolean isChannelEnabled(ChannelType channel, AlertType type) {
        return !Boolean.FALSE.equals(settings.get(channel.settingsKey()))
                && !Boolean.FALSE.equals(settings.get(channel.settingsKey(type)));
    }
}
