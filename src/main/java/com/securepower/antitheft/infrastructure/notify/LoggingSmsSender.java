package com.securepower.antitheft.infrastructure.notify;

import com.securepower.antitheft.domain.alert.AlertMessage;
import com.securepower.antitheft.domain.alert.ChannelType;
import com.securepower.antitheft.domain.ports.NotificationSender;
import com.securepower.antitheft.exception.ChannelDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

@Component
public class LoggingSmsSender implements NotificationSender {
    private static final Logger log = LoggerFactory.getLogger(LoggingSmsSender.class);

    private static final Pattern E164 = Pattern.compile("\\+[1-9]\\d{6,14}");

    @Override
    public ChannelType channel() {
        return ChannelType.SMS;
    }

    @Override
    public String send(String recipient, AlertMessage message) {
        if (recipient == null || !E164.matcher(recipient).matches()) {
            throw new ChannelDeliveryException("Invalid phone number");
        }
        String text = "SecurePower Alert: " + MessageText.headline(message)
                + ". Location: " + MessageText.location(message, 4)
                + ". Track: " + MessageText.trackingLink(message);
        String reference = "sms-" + UUID.randomUUID();
        log.warn("SMS {} to ***{}: {}", reference, recipient.substring(recipient.length() - 4), text);
        return reference;
    }
}
