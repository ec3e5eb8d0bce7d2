package com.securepower.antitheft.application;

import com.securepower.antitheft.config.AppProperties;
import com.securepower.antitheft.domain.alert.AlertMessage;
import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.alert.ChannelType;
import com.securepower.antitheft.domain.alert.NotificationOutcome;
import com.securepower.antitheft.domain.alert.SecurityEvent;
import com.securepower.antitheft.domain.alert.UserProfile;
import com.securepower.antitheft.domain.device.DeviceRecord;
import com.securepower.antitheft.domain.device.DeviceStatus;
import com.securepower.antitheft.domain.ports.NotificationSender;
import com.securepower.antitheft.domain.tracking.CloseReason;
import com.securepower.antitheft.domain.tracking.TrackingSession;
import com.securepower.antitheft.support.InMemoryStores;
import com.securepower.antitheft.support.MutableClock;
import com.securepower.antitheft.support.RecordingSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

// ==========================================================================
// Channel fan-out, skip rules, rate limits and timeouts
// ==========================================================================
class AlertDispatcherTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String DEVICE = "device-1";

    private MutableClock clock;
    private AppProperties props;
    private InMemoryStores.Events events;
    private InMemoryStores.SendLog sendLog;
    private InMemoryStores.Devices devices;
    private RecordingSender sms;
    private RecordingSender email;
    private RecordingSender push;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        props = new AppProperties();
        events = new InMemoryStores.Events();
        sendLog = new InMemoryStores.SendLog();
        devices = new InMemoryStores.Devices();
        devices.save(new DeviceRecord(DEVICE, "user-1", "Maria's Pixel", "Pixel 8", DeviceStatus.ACTIVE, null, null, null));
        sms = new RecordingSender(ChannelType.SMS);
        email = new RecordingSender(ChannelType.EMAIL);
        push = new RecordingSender(ChannelType.PUSH);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AlertDispatcher dispatcher() {
        return new AlertDispatcher(List.of(sms, email, push), sendLog, events, devices, executor, props, clock);
    }

    private static UserProfile user(Map<String, Boolean> settings) {
        return new UserProfile("user-1", "Maria", "+34600111222", List.of("family@example.com"),
                List.of("push-token-1"), settings);
    }

    private SecurityEvent stored(AlertType type) {
        SecurityEvent event = SecurityEvent.raise(DEVICE, "user-1", type, clock.instant(), Map.of(), null);
        return events.saveIfAbsent(event);
    }

    private static NotificationOutcome outcomeOf(List<NotificationOutcome> outcomes, ChannelType channel) {
        return outcomes.stream().filter(o -> o.channel() == channel).findFirst().orElseThrow();
    }

    @Test
    void shouldDeliverCriticalAlertOnEveryChannel() {
        SecurityEvent event = stored(AlertType.UNAUTHORIZED_POWEROFF);

        List<NotificationOutcome> outcomes = dispatcher().dispatch(event, user(Map.of()));

        assertThat(outcomes).extracting(NotificationOutcome::channel)
                .containsExactly(ChannelType.SMS, ChannelType.EMAIL, ChannelType.PUSH);
        assertThat(outcomes).allMatch(NotificationOutcome::sent);
        assertThat(sms.deliveries()).singleElement().satisfies(d -> {
            assertThat(d.recipient()).isEqualTo("+34600111222");
            assertThat(d.message().kind()).isEqualTo(AlertMessage.Kind.SECURITY_ALERT);
            assertThat(d.message().deviceName()).isEqualTo("Maria's Pixel");
            assertThat(d.message().ownerName()).isEqualTo("Maria");
        });

        SecurityEvent reloaded = events.findById(event.getEventId()).orElseThrow();
        assertThat(reloaded.isProcessed()).isTrue();
        assertThat(reloaded.getProcessedAt()).isEqualTo(T0);
        assertThat(reloaded.getOutcomes()).hasSize(3);
    }

    @Test
    void shouldIsolateFailingChannel() {
        sms.failing();
        SecurityEvent event = stored(AlertType.SIM_CHANGED);

        List<NotificationOutcome> outcomes = dispatcher().dispatch(event, user(Map.of()));

        NotificationOutcome smsOutcome = outcomeOf(outcomes, ChannelType.SMS);
        assertThat(smsOutcome.sent()).isFalse();
        assertThat(smsOutcome.error()).contains("provider unavailable");
        assertThat(outcomeOf(outcomes, ChannelType.EMAIL).sent()).isTrue();
        assertThat(outcomeOf(outcomes, ChannelType.PUSH).sent()).isTrue();
        assertThat(events.findById(event.getEventId()).orElseThrow().isProcessed()).isTrue();
        assertThat(sendLog.lastSentAt("user-1", ChannelType.SMS)).isEmpty();
    }

    @Test
    void shouldSendNonCriticalAlertsOnlyByPush() {
        SecurityEvent event = stored(AlertType.APP_UNINSTALL_ATTEMPT);

        List<NotificationOutcome> outcomes = dispatcher().dispatch(event, user(Map.of()));

        assertThat(outcomes).extracting(NotificationOutcome::channel).containsExactly(ChannelType.PUSH);
        assertThat(sms.deliveries()).isEmpty();
        assertThat(email.deliveries()).isEmpty();
        assertThat(push.deliveries()).hasSize(1);
    }

    @Test
    void shouldNeverCallCriticalOnlySenderForMinorAlert() {
        NotificationSender smsMock = mock(NotificationSender.class);
        when(smsMock.channel()).thenReturn(ChannelType.SMS);
        NotificationSender pushMock = mock(NotificationSender.class);
        when(pushMock.channel()).thenReturn(ChannelType.PUSH);
        when(pushMock.send(anyString(), any(AlertMessage.class))).thenReturn("push-ref-1");
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(smsMock, pushMock), sendLog, events, devices,
                executor, props, clock);

        List<NotificationOutcome> outcomes = dispatcher.dispatch(stored(AlertType.DEVICE_ADMIN_REMOVED), user(Map.of()));

        assertThat(outcomes).singleElement().satisfies(o -> assertThat(o.sent()).isTrue());
        verify(smsMock, never()).send(anyString(), any(AlertMessage.class));
        verify(pushMock).send(eq("push-token-1"), any(AlertMessage.class));
    }

    @Test
    void shouldSkipChannelsDisabledByUser() {
        SecurityEvent event = stored(AlertType.SIM_CHANGED);

        List<NotificationOutcome> outcomes = dispatcher().dispatch(event,
                user(Map.of("email", false, "push.SIM_CHANGED", false)));

        assertThat(outcomeOf(outcomes, ChannelType.EMAIL).skippedReason())
                .isEqualTo(NotificationOutcome.SKIP_DISABLED_BY_USER);
        assertThat(outcomeOf(outcomes, ChannelType.PUSH).skippedReason())
                .isEqualTo(NotificationOutcome.SKIP_DISABLED_BY_USER);
        assertThat(outcomeOf(outcomes, ChannelType.SMS).sent()).isTrue();
        assertThat(email.deliveries()).isEmpty();
    }

    @Test
    void shouldSkipChannelWithoutRecipient() {
        SecurityEvent event = stored(AlertType.UNAUTHORIZED_POWEROFF);
        UserProfile noNumber = new UserProfile("user-1", "Maria", null, List.of(), List.of("push-token-1"), Map.of());

        List<NotificationOutcome> outcomes = dispatcher().dispatch(event, noNumber);

        assertThat(outcomeOf(outcomes, ChannelType.SMS).skippedReason()).isEqualTo(NotificationOutcome.SKIP_NO_RECIPIENT);
        assertThat(outcomeOf(outcomes, ChannelType.EMAIL).skippedReason()).isEqualTo(NotificationOutcome.SKIP_NO_RECIPIENT);
        assertThat(outcomeOf(outcomes, ChannelType.PUSH).sent()).isTrue();
    }

    @Test
    void shouldRateLimitSmsForFiveMinutes() {
        AlertDispatcher dispatcher = dispatcher();
        UserProfile user = user(Map.of());

        assertThat(outcomeOf(dispatcher.dispatch(stored(AlertType.SIM_CHANGED), user), ChannelType.SMS).sent()).isTrue();

        clock.advance(Duration.ofSeconds(120));
        List<NotificationOutcome> second = dispatcher.dispatch(stored(AlertType.UNAUTHORIZED_POWEROFF), user);
        assertThat(outcomeOf(second, ChannelType.SMS).skippedReason()).isEqualTo(NotificationOutcome.SKIP_RATE_LIMIT);
        assertThat(outcomeOf(second, ChannelType.EMAIL).sent()).isTrue();

        clock.set(T0.plusSeconds(310));
        List<NotificationOutcome> third = dispatcher.dispatch(stored(AlertType.UNAUTHORIZED_POWEROFF), user);
        assertThat(outcomeOf(third, ChannelType.SMS).sent()).isTrue();
        assertThat(sms.deliveries()).hasSize(2);
    }

    @Test
    void shouldNotRateLimitAfterFailedSend() {
        AlertDispatcher dispatcher = dispatcher();
        sms.failingFor("+34600111222");

        dispatcher.dispatch(stored(AlertType.SIM_CHANGED), user(Map.of()));
        clock.advance(Duration.ofSeconds(10));
        List<NotificationOutcome> retry = dispatcher.dispatch(stored(AlertType.SIM_CHANGED),
                new UserProfile("user-1", "Maria", "+34600999888", List.of(), List.of(), Map.of()));

        assertThat(outcomeOf(retry, ChannelType.SMS).sent()).isTrue();
    }

    @Test
    void shouldRateLimitAcrossConcurrentDispatchesForSameUser() throws Exception {
        devices.save(new DeviceRecord("device-2", "user-1", "Maria's tablet", "Tab S9", DeviceStatus.ACTIVE, null, null, null));
        sms.stalling(Duration.ofMillis(300));
        AlertDispatcher dispatcher = dispatcher();
        UserProfile user = user(Map.of());
        SecurityEvent onPhone = events.saveIfAbsent(
                SecurityEvent.raise(DEVICE, "user-1", AlertType.SIM_CHANGED, T0, Map.of(), null));
        SecurityEvent onTablet = events.saveIfAbsent(
                SecurityEvent.raise("device-2", "user-1", AlertType.UNAUTHORIZED_POWEROFF, T0, Map.of(), null));

        ExecutorService callers = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<List<NotificationOutcome>> first = callers.submit(() -> {
                start.await();
                return dispatcher.dispatch(onPhone, user);
            });
            Future<List<NotificationOutcome>> second = callers.submit(() -> {
                start.await();
                return dispatcher.dispatch(onTablet, user);
            });
            start.countDown();

            List<NotificationOutcome> smsOutcomes = List.of(
                    outcomeOf(first.get(30, TimeUnit.SECONDS), ChannelType.SMS),
                    outcomeOf(second.get(30, TimeUnit.SECONDS), ChannelType.SMS));

            assertThat(sms.deliveries()).hasSize(1);
            assertThat(smsOutcomes).filteredOn(NotificationOutcome::sent).hasSize(1);
            assertThat(smsOutcomes).extracting(NotificationOutcome::skippedReason)
                    .containsOnlyOnce(NotificationOutcome.SKIP_RATE_LIMIT);
            assertThat(email.deliveries()).hasSize(2);
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void shouldRestorePreviousSendTimeWhenReservedSendFails() {
        AlertDispatcher dispatcher = dispatcher();
        UserProfile user = user(Map.of());
        dispatcher.dispatch(stored(AlertType.SIM_CHANGED), user);

        clock.set(T0.plusSeconds(400));
        sms.failing();
        assertThat(outcomeOf(dispatcher.dispatch(stored(AlertType.SIM_CHANGED), user), ChannelType.SMS).isError()).isTrue();

        assertThat(sendLog.lastSentAt("user-1", ChannelType.SMS)).contains(T0);
    }

    @Test
    void shouldTimeOutSlowChannelWithoutBlockingOthers() {
        props.getAlerts().setChannelTimeout(Duration.ofMillis(300));
        email.stalling(Duration.ofSeconds(10));
        SecurityEvent event = stored(AlertType.UNAUTHORIZED_POWEROFF);

        long started = System.nanoTime();
        List<NotificationOutcome> outcomes = dispatcher().dispatch(event, user(Map.of()));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(outcomeOf(outcomes, ChannelType.EMAIL).error()).isEqualTo(NotificationOutcome.ERROR_TIMEOUT);
        assertThat(outcomeOf(outcomes, ChannelType.SMS).sent()).isTrue();
        assertThat(outcomeOf(outcomes, ChannelType.PUSH).sent()).isTrue();
        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
        assertThat(events.findById(event.getEventId()).orElseThrow().isProcessed()).isTrue();
    }

    @Test
    void shouldCountChannelSentWhenAnyRecipientAccepts() {
        email.failingFor("broken@example.com");
        UserProfile user = new UserProfile("user-1", "Maria", null,
                List.of("broken@example.com", "family@example.com"), List.of(), Map.of());

        List<NotificationOutcome> outcomes = dispatcher().dispatch(stored(AlertType.SIM_CHANGED), user);

        assertThat(outcomeOf(outcomes, ChannelType.EMAIL).sent()).isTrue();
        assertThat(email.deliveries()).extracting(RecordingSender.Delivery::recipient)
                .containsExactly("family@example.com");
    }

    @Test
    void shouldReportEveryRecipientErrorWhenAllFail() {
        email.failing();
        UserProfile user = new UserProfile("user-1", "Maria", null,
                List.of("first@example.com", "second@example.com"), List.of(), Map.of());

        NotificationOutcome outcome = outcomeOf(dispatcher().dispatch(stored(AlertType.SIM_CHANGED), user), ChannelType.EMAIL);

        assertThat(outcome.sent()).isFalse();
        assertThat(outcome.error()).contains("****.com").contains(";");
    }

    @Test
    void shouldNotResendChannelAlreadyDelivered() {
        SecurityEvent event = new SecurityEvent(UUID.randomUUID(), DEVICE, "user-1", AlertType.SIM_CHANGED, T0,
                Map.of(), null, null, false, null, null,
                List.of(NotificationOutcome.sent(ChannelType.SMS, T0.minusSeconds(5))));
        events.save(event);

        List<NotificationOutcome> outcomes = dispatcher().dispatch(event, user(Map.of()));

        assertThat(sms.deliveries()).isEmpty();
        assertThat(outcomes).extracting(NotificationOutcome::channel).containsExactly(ChannelType.EMAIL, ChannelType.PUSH);
        assertThat(events.findById(event.getEventId()).orElseThrow().hasSentOn(ChannelType.SMS)).isTrue();
    }

    @Test
    void shouldRejectEventWithoutIdentifiers() {
        SecurityEvent anonymous = SecurityEvent.raise(null, "user-1", AlertType.SIM_CHANGED, T0, Map.of(), null);

        assertThatThrownBy(() -> dispatcher().dispatch(anonymous, user(Map.of())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(sms.deliveries()).isEmpty();
    }

    @Test
    void shouldSendSessionSummaryByEmail() {
        TrackingSession session = TrackingSession.open(DEVICE, "user-1", AlertType.UNAUTHORIZED_POWEROFF, T0, 500);
        session.close(T0.plus(Duration.ofHours(1)), CloseReason.OWNER_CLOSED);

        NotificationOutcome outcome = dispatcher().dispatchSummary(session, user(Map.of()));

        assertThat(outcome.channel()).isEqualTo(ChannelType.EMAIL);
        assertThat(outcome.sent()).isTrue();
        assertThat(email.deliveries()).singleElement().satisfies(d -> {
            assertThat(d.message().kind()).isEqualTo(AlertMessage.Kind.TRACKING_SUMMARY);
            assertThat(d.message().sessionId()).isEqualTo(session.getSessionId());
            assertThat(d.message().details()).containsEntry("closeReason", "OWNER_CLOSED");
        });
    }

    @Test
    void shouldRefuseDuplicateSenderForChannel() {
        assertThatThrownBy(() -> new AlertDispatcher(List.of(sms, new RecordingSender(ChannelType.SMS)),
                sendLog, events, devices, executor, props, clock))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldMaskRecipientsInLogs() {
        assertThat(AlertDispatcher.mask("+34600111222")).isEqualTo("****1222");
        assertThat(AlertDispatcher.mask("abc")).isEqualTo("****");
    }
}
