package com.securepower.antitheft.infrastructure.notify;

import com.securepower.antitheft.domain.alert.AlertMessage;
import com.securepower.antitheft.domain.alert.ChannelType;
import com.securepower.antitheft.domain.ports.NotificationSender;
import com.securepower.antitheft.exception.ChannelDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class LoggingPushSender implements NotificationSender {
    private static final Logger log = LoggerFactory.getLogger(LoggingPushSender.class);

    @Override
    public ChannelType channel() {
        return ChannelType.PUSH;
    }

    @Override
    public String send(String recipient, AlertMessage message) {
        if (recipient == null || recipient.isBlank()) {
            throw new ChannelDeliveryException("Empty push token");
        }
        String reference = "push-" + UUID.randomUUID();
        log.warn("Push {} - title: 'Security Alert', body: '{}', session: {}",
                reference, MessageText.headline(message), message.sessionId());
        return reference;
    }
}
