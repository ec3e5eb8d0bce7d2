package com.securepower.antitheft.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;

@Entity
@Table(name = "channel_send_log")
public class ChannelSendLogEntity {

    // "<userId>:<channel>"
    @Id
    @Column(length = 160)
    private String id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(nullable = false, length = 20)
    private String channel;

    @Column(name = "last_sent_at", nullable = false)
    private OffsetDateTime lastSentAt;

    public ChannelSendLogEntity() {}

    public static String idFor(String userId, String channel) {
        return userId + ":" + channel;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getChannel() { return channel; }
    public void setChannel(String channel) { this.channel = channel; }

    public OffsetDateTime getLastSentAt() { return lastSentAt; }
    public void setLastSentAt(OffsetDateTime lastSentAt) { this.lastSentAt = lastSentAt; }
}
