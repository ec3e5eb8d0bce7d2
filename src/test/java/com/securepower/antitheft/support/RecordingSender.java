package com.securepower.antitheft.support;

import com.securepower.antitheft.domain.alert.AlertMessage;
import com.securepower.antitheft.domain.alert.ChannelType;
import com.securepower.antitheft.domain.ports.NotificationSender;
import com.securepower.antitheft.exception.ChannelDeliveryException;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sender double that records deliveries and can be told to fail or stall.
 */
public class RecordingSender implements NotificationSender {

    public record Delivery(String recipient, AlertMessage message) {
    }

    private final ChannelType channel;
    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private final Set<String> failingRecipients = ConcurrentHashMap.newKeySet();
    private volatile boolean failAll;
    private volatile Duration delay = Duration.ZERO;

    public RecordingSender(ChannelType channel) {
        this.channel = channel;
    }

    public RecordingSender failing() {
        this.failAll = true;
        return this;
    }

    public RecordingSender failingFor(String recipient) {
        failingRecipients.add(recipient);
        return this;
    }

    public RecordingSender stalling(Duration delay) {
        this.delay = delay;
        return this;
    }

    public List<Delivery> deliveries() {
        return deliveries;
    }

    @Override
    public ChannelType channel() {
        return channel;
    }

    @Override
    public String send(String recipient, AlertMessage message) {
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ChannelDeliveryException("interrupted");
            }
        }
        if (failAll || failingRecipients.contains(recipient)) {
            throw new ChannelDeliveryException(channel + " provider unavailable");
        }
        deliveries.add(new Delivery(recipient, message));
        return channel.name().toLowerCase() + "-" + deliveries.size();
    }
}
