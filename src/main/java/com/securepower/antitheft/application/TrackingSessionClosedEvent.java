package com.securepower.antitheft.application;

import com.securepower.antitheft.domain.tracking.TrackingSession;

/**
 * Published once when a tracking session becomes inactive, whatever the reason.
 */
public record TrackingSessionClosedEvent(TrackingSession session) {
}
