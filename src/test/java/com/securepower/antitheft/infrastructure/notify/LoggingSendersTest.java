package com.securepower.antitheft.infrastructure.notify;

import com.securepower.antitheft.domain.alert.AlertMessage;
import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.tracking.LocationPoint;
import com.securepower.antitheft.exception.ChannelDeliveryException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoggingSendersTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static AlertMessage alert(LocationPoint location, String sessionId) {
        return new AlertMessage(AlertMessage.Kind.SECURITY_ALERT, UUID.randomUUID(), AlertType.SIM_CHANGED,
                "device-1", "Maria's Pixel", "Maria", T0, sessionId, Map.of(), location);
    }

    @Test
    void shouldAcceptOnlyE164Numbers() {
        LoggingSmsSender sms = new LoggingSmsSender();
        AlertMessage message = alert(null, null);

        assertThat(sms.send("+34600111222", message)).startsWith("sms-");
        assertThatThrownBy(() -> sms.send("600111222", message)).isInstanceOf(ChannelDeliveryException.class);
        assertThatThrownBy(() -> sms.send("+0123456789", message)).isInstanceOf(ChannelDeliveryException.class);
        assertThatThrownBy(() -> sms.send(null, message)).isInstanceOf(ChannelDeliveryException.class);
    }

    @Test
    void shouldValidateEmailAndPushRecipients() {
        AlertMessage message = alert(null, null);

        assertThat(new LoggingEmailSender().send("family@example.com", message)).startsWith("email-");
        assertThatThrownBy(() -> new LoggingEmailSender().send("not-an-address", message))
                .isInstanceOf(ChannelDeliveryException.class);
        assertThat(new LoggingPushSender().send("token-abc", message)).startsWith("push-");
        assertThatThrownBy(() -> new LoggingPushSender().send(" ", message))
                .isInstanceOf(ChannelDeliveryException.class);
    }

    @Test
    void shouldRenderLocationAndTrackingLink() {
        LocationPoint point = LocationPoint.of(40.416775, -3.703790, 5.0, T0);

        assertThat(MessageText.location(alert(point, null), 4)).isEqualTo("40.4168, -3.7038");
        assertThat(MessageText.location(alert(point.withAddress("Puerta del Sol"), null), 4)).isEqualTo("Puerta del Sol");
        assertThat(MessageText.location(alert(null, null), 4)).isEqualTo("Location unavailable");
        assertThat(MessageText.trackingLink(alert(null, "device-1_1772359200000")))
                .isEqualTo("https://securepower.app/t/device-1");
        assertThat(MessageText.headline(alert(null, null))).isEqualTo("SIM card changed on Maria's Pixel");
    }
}
