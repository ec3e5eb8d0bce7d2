// ==============================================================================
// Alert Dispatcher - parallel, independently failing channel delivery
// File: src/main/java/com/securepower/antitheft/application/AlertDispatcher.java
// ==============================================================================

package com.securepower.antitheft.application;

import com.securepower.antitheft.config.AppProperties;
import com.securepower.antitheft.domain.alert.AlertMessage;
import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.alert.ChannelType;
import com.securepower.antitheft.domain.alert.NotificationOutcome;
import com.securepower.antitheft.domain.alert.SecurityEvent;
import com.securepower.antitheft.domain.alert.UserProfile;
import com.securepower.antitheft.domain.device.DeviceRecord;
import com.securepower.antitheft.domain.ports.ChannelSendLogRepository;
import com.securepower.antitheft.domain.ports.DeviceRepository;
import com.securepower.antitheft.domain.ports.NotificationSender;
import com.securepower.antitheft.domain.ports.SecurityEventRepository;
import com.securepower.antitheft.domain.tracking.TrackingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final Map<ChannelType, NotificationSender> senders = new EnumMap<>(ChannelType.class);
    private final ChannelSendLogRepository sendLog;
    private final SecurityEventRepository events;
    private final DeviceRepository devices;
    private final ExecutorService executor;
    private final Clock clock;

    // One lock per user and rate-limited channel
    private final ConcurrentHashMap<String, ReentrantLock> rateLimitLocks = new ConcurrentHashMap<>();

    // Configuration
    private final Duration channelTimeout;
    private final AppProperties.Alerts alertProps;
    private final ChannelType summaryChannel;

    public AlertDispatcher(List<NotificationSender> senders,
                           ChannelSendLogRepository sendLog,
                           SecurityEventRepository events,
                           DeviceRepository devices,
                           @Qualifier("alertDispatchExecutor") ExecutorService executor,
                           AppProperties props,
                           Clock clock) {
        for (NotificationSender sender : senders) {
            NotificationSender previous = this.senders.putIfAbsent(sender.channel(), sender);
            if (previous != null) {
                throw new IllegalStateException("Two senders registered for channel " + sender.channel());
            }
        }
        this.sendLog = sendLog;
        this.events = events;
        this.devices = devices;
        this.executor = executor;
        this.clock = clock;
        this.alertProps = props.getAlerts();
        this.channelTimeout = alertProps.getChannelTimeout();
        this.summaryChannel = props.getTracking().getSummaryChannel();

        log.info("✅ Alert dispatcher initialized - Channels: {}, Timeout: {}ms",
                this.senders.keySet(), channelTimeout.toMillis());
    }

    /**
     * Delivers the event over every eligible channel in parallel and records the outcomes
     * on the event, which is then marked processed. A failing channel never stops the others.
     * Channels that already delivered this event are left out.
     *
     * @return the outcomes of this dispatch, in channel order
     */
    public List<NotificationOutcome> dispatch(SecurityEvent event, UserProfile user) {
        event.requireIdentifiers();
        log.info("📣 Dispatching {} alert {} for device {}", event.getType(), event.getEventId(), event.getDeviceId());

        AlertMessage message = AlertMessage.forEvent(event, deviceNameOf(event.getDeviceId()), user.getName());
        Instant now = clock.instant();

        Map<ChannelType, NotificationOutcome> results = new EnumMap<>(ChannelType.class);
        Map<ChannelType, Future<NotificationOutcome>> inFlight = new EnumMap<>(ChannelType.class);
        Map<ChannelType, Optional<Instant>> reservations = new EnumMap<>(ChannelType.class);
        long deadline = System.nanoTime() + channelTimeout.toNanos();

        for (ChannelType channel : ChannelType.values()) {
            if (!channel.isEligibleFor(event.getType())) {
                continue;
            }
            NotificationSender sender = senders.get(channel);
            if (sender == null) {
                log.debug("No sender registered for {}", channel);
                continue;
            }
            if (event.hasSentOn(channel)) {
                log.info("↩️ {} already delivered for event {}", channel, event.getEventId());
                continue;
            }

            Optional<NotificationOutcome> skip = precheck(channel, event.getType(), user);
            if (skip.isEmpty() && !tryReserve(user.getUserId(), channel, now, reservations)) {
                skip = Optional.of(NotificationOutcome.skipped(channel, NotificationOutcome.SKIP_RATE_LIMIT));
            }
            if (skip.isPresent()) {
                log.info("⏭️ {} skipped for event {}: {}", channel, event.getEventId(), skip.get().skippedReason());
                results.put(channel, skip.get());
                continue;
            }

            List<String> recipients = user.recipientsFor(channel);
            inFlight.put(channel, executor.submit(() -> deliver(sender, recipients, message)));
        }

        inFlight.forEach((channel, future) -> {
            NotificationOutcome outcome = await(channel, future, deadline);
            if (outcome.sent()) {
                sendLog.recordSent(user.getUserId(), channel, outcome.sentAt());
            } else if (reservations.containsKey(channel)) {
                release(user.getUserId(), channel, reservations.get(channel));
            }
            results.put(channel, outcome);
        });

        List<NotificationOutcome> outcomes = new ArrayList<>(results.values());
        event.recordOutcomes(outcomes);
        event.markProcessed(clock.instant());
        events.save(event);

        log.info("✅ Event {} processed - outcomes: {}", event.getEventId(), outcomes);
        return outcomes;
    }

    /**
     * Sends the summary of a closed session over the summary channel. Not rate limited.
     */
    public NotificationOutcome dispatchSummary(TrackingSession session, UserProfile user) {
        ChannelType channel = summaryChannel;
        NotificationSender sender = senders.get(channel);
        List<String> recipients = user.recipientsFor(channel);

        NotificationOutcome outcome;
        if (!user.isChannelEnabled(channel, session.getAlertType())) {
            outcome = NotificationOutcome.skipped(channel, NotificationOutcome.SKIP_DISABLED_BY_USER);
        } else if (sender == null || recipients.isEmpty()) {
            outcome = NotificationOutcome.skipped(channel, NotificationOutcome.SKIP_NO_RECIPIENT);
        } else {
            AlertMessage message = AlertMessage.forSessionSummary(session, deviceNameOf(session.getDeviceId()), user.getName());
            long deadline = System.nanoTime() + channelTimeout.toNanos();
            outcome = await(channel, executor.submit(() -> deliver(sender, recipients, message)), deadline);
        }

        log.info("🧾 Tracking summary for session {} via {}: {}", session.getSessionId(), channel, outcome);
        return outcome;
    }

    private Optional<NotificationOutcome> precheck(ChannelType channel, AlertType type, UserProfile user) {
        if (!user.isChannelEnabled(channel, type)) {
            return Optional.of(NotificationOutcome.skipped(channel, NotificationOutcome.SKIP_DISABLED_BY_USER));
        }
        if (user.recipientsFor(channel).isEmpty()) {
            return Optional.of(NotificationOutcome.skipped(channel, NotificationOutcome.SKIP_NO_RECIPIENT));
        }
        return Optional.empty();
    }

    /**
     * Claims a rate-limited channel for this user by recording the send up front, so a dispatch
     * for another of the user's devices sees it immediately. The previous send time is kept in
     * {@code reservations} for {@link #release}.
     *
     * @return false when the channel is still inside its minimum interval
     */
    private boolean tryReserve(String userId, ChannelType channel, Instant now,
                               Map<ChannelType, Optional<Instant>> reservations) {
        Duration minInterval = alertProps.rateLimitFor(channel);
        if (minInterval.isZero() || minInterval.isNegative()) {
            return true;
        }

        ReentrantLock lock = rateLimitLockFor(userId, channel);
        lock.lock();
        try {
            Optional<Instant> last = sendLog.lastSentAt(userId, channel);
            if (last.isPresent() && Duration.between(last.get(), now).compareTo(minInterval) < 0) {
                return false;
            }
            sendLog.recordSent(userId, channel, now);
            reservations.put(channel, last);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // The reserved send did not go out; put back the send it replaced
    private void release(String userId, ChannelType channel, Optional<Instant> previous) {
        ReentrantLock lock = rateLimitLockFor(userId, channel);
        lock.lock();
        try {
            if (previous.isPresent()) {
                sendLog.recordSent(userId, channel, previous.get());
            } else {
                sendLog.clear(userId, channel);
            }
            log.debug("Released {} reservation for user {}", channel, userId);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock rateLimitLockFor(String userId, ChannelType channel) {
        return rateLimitLocks.computeIfAbsent(userId + ":" + channel, key -> new ReentrantLock());
    }

    /**
     * Runs on a dispatch worker. The channel counts as sent once any recipient accepted.
     */
    private NotificationOutcome deliver(NotificationSender sender, List<String> recipients, AlertMessage message) {
        ChannelType channel = sender.channel();
        List<String> errors = new ArrayList<>();
        int delivered = 0;

        for (String recipient : recipients) {
            if (Thread.currentThread().isInterrupted()) {
                errors.add("cancelled");
                break;
            }
            try {
                String reference = sender.send(recipient, message);
                delivered++;
                log.info("📤 {} delivered to {} (ref: {})", channel, mask(recipient), reference);
            } catch (RuntimeException e) {
                log.warn("⚠️ {} delivery to {} failed: {}", channel, mask(recipient), e.getMessage());
                errors.add(mask(recipient) + ": " + e.getMessage());
            }
        }

        if (delivered > 0) {
            return NotificationOutcome.sent(channel, clock.instant());
        }
        return NotificationOutcome.error(channel, String.join("; ", errors));
    }

    private NotificationOutcome await(ChannelType channel, Future<NotificationOutcome> future, long deadlineNanos) {
        try {
            return future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏱️ {} delivery timed out after {}ms", channel, channelTimeout.toMillis());
            return NotificationOutcome.error(channel, NotificationOutcome.ERROR_TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("❌ {} delivery crashed: {}", channel, cause.getMessage(), cause);
            return NotificationOutcome.error(channel, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return NotificationOutcome.error(channel, "interrupted");
        }
    }

    private String deviceNameOf(String deviceId) {
        return devices.findById(deviceId).map(DeviceRecord::getDeviceName).orElse(deviceId);
    }

    static String mask(String recipient) {
        if (recipient == null || recipient.length() <= 4) {
            return "****";
        }
        return "****" + recipient.substring(recipient.length() - 4);
    }
}
