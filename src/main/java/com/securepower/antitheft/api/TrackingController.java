package com.securepower.antitheft.api;

import com.securepower.antitheft.api.dto.LocationRequest;
import com.securepower.antitheft.application.TrackingService;
import com.securepower.antitheft.domain.tracking.CloseReason;
import com.securepower.antitheft.domain.tracking.TrackingSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/tracking")
@Tag(name = "Tracking", description = "Location tracking sessions opened by security alerts")
public class TrackingController {

    private final TrackingService tracking;
    private final Clock clock;

    public TrackingController(TrackingService tracking, Clock clock) {
        this.tracking = tracking;
        this.clock = clock;
    }

    @PostMapping("/{sessionId}/locations")
    @Operation(summary = "Append a location", description = "Only the newest 500 points of a session are kept.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Point recorded (or ignored as a duplicate timestamp)"),
        @ApiResponse(responseCode = "404", description = "Unknown session"),
        @ApiResponse(responseCode = "409", description = "Session no longer active")
    })
    public ResponseEntity<?> append(@PathVariable("sessionId") String sessionId,
                                    @RequestBody @Valid LocationRequest request) {
        TrackingSession session = tracking.append(sessionId, request.toPoint(clock.instant()));
        return ResponseEntity.ok(Map.of(
                "sessionId", sessionId,
                "active", session.isActive(),
                "locationCount", session.getLocationCount()));
    }

    @PostMapping("/{sessionId}/close")
    @Operation(summary = "Close a session", description = "Stops tracking and sends the session summary. Closing twice is harmless.")
    public ResponseEntity<?> close(@PathVariable("sessionId") String sessionId) {
        return ResponseEntity.ok(sessionBody(tracking.close(sessionId, CloseReason.OWNER_CLOSED), false));
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get a session", description = "Session state and its recorded points, oldest first.")
    public ResponseEntity<?> get(@PathVariable("sessionId") String sessionId) {
        return ResponseEntity.ok(sessionBody(tracking.get(sessionId), true));
    }

    private Map<String, Object> sessionBody(TrackingSession s, boolean withLocations) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", s.getSessionId());
        body.put("deviceId", s.getDeviceId());
        body.put("alertType", s.getAlertType().name());
        body.put("active", s.isActive());
        body.put("startTime", s.getStartTime().toString());
        body.put("endTime", s.getEndTime() != null ? s.getEndTime().toString() : null);
        body.put("closeReason", s.getCloseReason() != null ? s.getCloseReason().name() : null);
        body.put("lastUpdate", s.getLastUpdate() != null ? s.getLastUpdate().toString() : null);
        body.put("lastLocation", s.getLastLocation().map(LocationRequest::toBody).orElse(null));
        body.put("locationCount", s.getLocationCount());
        if (withLocations) {
            body.put("locations", s.getLocations().stream().map(LocationRequest::toBody).toList());
        }
        return body;
    }
}
