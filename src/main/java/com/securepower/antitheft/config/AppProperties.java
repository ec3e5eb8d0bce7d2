package com.securepower.antitheft.config;

import com.securepower.antitheft.domain.alert.ChannelType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {
    private Auth auth = new Auth();
    private Alerts alerts = new Alerts();
    private Tracking tracking = new Tracking();

    public Auth getAuth() { return auth; }
    public void setAuth(Auth auth) { this.auth = auth; }

    public Alerts getAlerts() { return alerts; }
    public void setAlerts(Alerts alerts) { this.alerts = alerts; }

    public Tracking getTracking() { return tracking; }
    public void setTracking(Tracking tracking) { this.tracking = tracking; }

    public static class Auth {
        // failures allowed before the next one escalates
        private int failureThreshold = 2;
        private Duration lockoutDuration = Duration.ofSeconds(30);

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public Duration getLockoutDuration() { return lockoutDuration; }
        public void setLockoutDuration(Duration lockoutDuration) { this.lockoutDuration = lockoutDuration; }
    }

    public static class Alerts {
        private Duration channelTimeout = Duration.ofSeconds(10);
        private int dispatchThreads = 8;
        private Map<ChannelType, Duration> rateLimits = new EnumMap<>(Map.of(ChannelType.SMS, Duration.ofMinutes(5)));

        public Duration getChannelTimeout() { return channelTimeout; }
        public void setChannelTimeout(Duration channelTimeout) { this.channelTimeout = channelTimeout; }

        public int getDispatchThreads() { return dispatchThreads; }
        public void setDispatchThreads(int dispatchThreads) { this.dispatchThreads = dispatchThreads; }

        public Map<ChannelType, Duration> getRateLimits() { return rateLimits; }
        public void setRateLimits(Map<ChannelType, Duration> rateLimits) { this.rateLimits = rateLimits; }

        public Duration rateLimitFor(ChannelType channel) {
            return rateLimits.getOrDefault(channel, Duration.ZERO);
        }
    }

    public static class Tracking {
        private int retentionCap = 500;
        private Duration maxAge = Duration.ofHours(24);
        private ChannelType summaryChannel = ChannelType.EMAIL;

        public int getRetentionCap() { return retentionCap; }
        public void setRetentionCap(int retentionCap) { this.retentionCap = retentionCap; }

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public ChannelType getSummaryChannel() { return summaryChannel; }
        public void setSummaryChannel(ChannelType summaryChannel) { this.summaryChannel = summaryChannel; }
    }
}
