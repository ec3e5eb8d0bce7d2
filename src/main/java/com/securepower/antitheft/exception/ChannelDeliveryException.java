package com.securepower.antitheft.exception;

/**
 * A notification provider refused or could not take a message. Recorded on the channel
 * outcome; never aborts a dispatch.
 */
public class ChannelDeliveryException extends RuntimeException {

    public ChannelDeliveryException(String message) {
        super(message);
    }

    public ChannelDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
