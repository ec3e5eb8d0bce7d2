package com.securepower.antitheft.infrastructure.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.OffsetDateTime;

@Embeddable
public class NotificationOutcomeEmbeddable {

    @Column(nullable = false, length = 20)
    private String channel;

    @Column(nullable = false)
    private boolean sent;

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "skipped_reason", length = 40)
    private String skippedReason;

    @Column(name = "error_message", length = 2000)
    private String error;

    public NotificationOutcomeEmbeddable() {}

    public String getChannel() { return channel; }
    public void setChannel(String channel) { this.channel = channel; }

    public boolean isSent() { return sent; }
    public void setSent(boolean sent) { this.sent = sent; }

    public OffsetDateTime getSentAt() { return sentAt; }
    public void setSentAt(OffsetDateTime sentAt) { this.sentAt = sentAt; }

    public String getSkippedReason() { return skippedReason; }
    public void setSkippedReason(String skippedReason) { this.skippedReason = skippedReason; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
}
