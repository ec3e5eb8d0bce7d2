package com.securepower.antitheft.domain.ports;

import com.securepower.antitheft.domain.alert.ChannelType;

import java.time.Instant;
import java.util.Optional;

/**
 * Last successful send per user and channel, consulted by channel rate limits.
 */
public interface ChannelSendLogRepository {
    Optional<Instant> lastSentAt(String userId, ChannelType channel);
    void recordSent(String userId, ChannelType channel, Instant sentAt);
    void clear(String userId, ChannelType channel);
}
