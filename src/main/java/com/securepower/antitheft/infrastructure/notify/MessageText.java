package com.securepower.antitheft.infrastructure.notify;

import com.securepower.antitheft.domain.alert.AlertMessage;
import com.securepower.antitheft.domain.tracking.LocationPoint;

import java.util.Locale;

/**
 * Plain-text pieces shared by the logging senders.
 */
final class MessageText {

    private static final String TRACKING_BASE_URL = "https://securepower.app/t/";

    private MessageText() {
    }

    static String headline(AlertMessage message) {
        if (message.kind() == AlertMessage.Kind.TRACKING_SUMMARY) {
            return "Tracking ended for " + deviceLabel(message);
        }
        return message.alertType().getDescription() + " on " + deviceLabel(message);
    }

    static String location(AlertMessage message, int decimals) {
        LocationPoint location = message.location();
        if (location == null) {
            return "Location unavailable";
        }
        if (location.address() != null) {
            return location.address();
        }
        String pattern = "%." + decimals + "f, %." + decimals + "f";
        return String.format(Locale.ROOT, pattern, location.lat(), location.lng());
    }

    static String trackingLink(AlertMessage message) {
        if (message.sessionId() == null) {
            return "https://securepower.app";
        }
        String id = message.sessionId();
        return TRACKING_BASE_URL + id.substring(0, Math.min(8, id.length()));
    }

    private static String deviceLabel(AlertMessage message) {
        return message.deviceName() != null ? message.deviceName() : "your device";
    }
}
