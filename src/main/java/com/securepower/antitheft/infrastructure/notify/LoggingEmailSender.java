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
public class LoggingEmailSender implements NotificationSender {
    private static final Logger log = LoggerFactory.getLogger(LoggingEmailSender.class);

    @Override
    public ChannelType channel() {
        return ChannelType.EMAIL;
    }

    @Override
    public String send(String recipient, AlertMessage message) {
        if (recipient == null || recipient.indexOf('@') < 1) {
            throw new ChannelDeliveryException("Invalid e-mail address");
        }
        String subject = message.kind() == AlertMessage.Kind.TRACKING_SUMMARY
                ? "Tracking summary: " + MessageText.headline(message)
                : "Security Alert: " + MessageText.headline(message);
        String reference = "email-" + UUID.randomUUID();
        log.warn("E-mail {} to {} - subject: '{}', owner: {}, location: {}, details: {}",
                reference, recipient, subject, message.ownerName(), MessageText.location(message, 6), message.details());
        return reference;
    }
}
