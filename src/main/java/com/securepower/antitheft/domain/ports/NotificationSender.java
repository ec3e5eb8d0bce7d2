package com.securepower.antitheft.domain.ports;

import com.securepower.antitheft.domain.alert.AlertMessage;
import com.securepower.antitheft.domain.alert.ChannelType;
import com.securepower.antitheft.exception.ChannelDeliveryException;

/**
 * Delivery capability of one notification channel.
 */
public interface NotificationSender {

    ChannelType channel();

    /**
     * @return provider reference of the accepted message
     * @throws ChannelDeliveryException when the provider refuses or cannot be reached
     */
    String send(String recipient, AlertMessage message);
}
