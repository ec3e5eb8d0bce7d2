package com.securepower.antitheft.infrastructure.scheduling;

import com.securepower.antitheft.application.TrackingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class TrackingExpiryJob {
  private static final Logger log = LoggerFactory.getLogger(TrackingExpiryJob.class);

  private final TrackingService tracking;
  private final boolean enabled;

  public TrackingExpiryJob(
          TrackingService tracking,
          @Value("${app.tracking.expiry-enabled:true}") boolean enabled) {
    this.tracking = tracking;
    this.enabled = enabled;

    log.info("TrackingExpiryJob initialized - enabled: {}", enabled);
  }

  @Scheduled(fixedDelayString = "${app.tracking.expiry-poll-ms:60000}")
  public void sweep() {
    if (!enabled) {
      log.debug("Tracking expiry sweep is disabled");
      return;
    }

    try {
      int closed = tracking.expireStaleSessions();
      if (closed > 0) {
        log.info("Expiry sweep closed {} tracking session(s)", closed);
      } else {
        log.trace("No tracking sessions past their age limit");
      }
    } catch (Exception e) {
      log.error("Error during tracking expiry sweep: {}", e.getMessage(), e);
    }
  }
}
