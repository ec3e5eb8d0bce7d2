// ==============================================================================
// Alert API - external security triggers and the event audit trail
// File: src/main/java/com/securepower/antitheft/api/AlertController.java
// ==============================================================================

package com.securepower.antitheft.api;

import com.securepower.antitheft.api.dto.LocationRequest;
import com.securepower.antitheft.application.SecurityOrchestrator;
import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.alert.NotificationOutcome;
import com.securepower.antitheft.domain.alert.SecurityEvent;
import com.securepower.antitheft.domain.tracking.LocationPoint;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/alerts")
@Tag(name = "Security Alerts", description = "Report device security triggers and inspect their delivery")
public class AlertController {

    private static final Logger log = LoggerFactory.getLogger(AlertController.class);

    private final SecurityOrchestrator orchestrator;
    private final Clock clock;

    public AlertController(SecurityOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @PostMapping
    @Operation(
        summary = "Report a security trigger",
        description = """
        Raised by the device for SIM changes, power-off attempts, uninstall attempts and admin removal.
        The event is stored and processed in the background: a tracking session is opened and the
        owner's trusted contacts are alerted.
        """
    )
    @ApiResponses({
        @ApiResponse(responseCode = "202", description = "Event accepted",
            content = @Content(mediaType = "application/json", examples = @ExampleObject(value = """
            { "eventId": "3f2b...", "status": "ACCEPTED" }
            """))),
        @ApiResponse(responseCode = "404", description = "Unknown device")
    })
    public ResponseEntity<?> report(@RequestBody @Valid ReportAlertRequest request) {
        LocationPoint location = request.location != null ? request.location.toPoint(clock.instant()) : null;
        SecurityEvent event = orchestrator.report(request.deviceId, request.type, request.details, location);

        log.info("Alert {} accepted for device {}", event.getEventId(), request.deviceId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("eventId", event.getEventId().toString(), "status", "ACCEPTED"));
    }

    @GetMapping("/{eventId}")
    @Operation(summary = "Get a security event", description = "Audit record with the per-channel delivery outcomes.")
    public ResponseEntity<?> get(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(eventBody(orchestrator.get(eventId)));
    }

    @GetMapping
    @Operation(summary = "List a device's security events", description = "Newest first.")
    public ResponseEntity<?> history(@RequestParam("deviceId") String deviceId) {
        List<Map<String, Object>> events = orchestrator.history(deviceId).stream().map(this::eventBody).toList();
        return ResponseEntity.ok(Map.of("deviceId", deviceId, "events", events));
    }

    @PostMapping("/{eventId}/process")
    @Operation(
        summary = "Process an event now",
        description = "Synchronous retry of an unprocessed event. Channels that already delivered are not resent."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Event processed"),
        @ApiResponse(responseCode = "422", description = "Event cannot be processed (missing device or owner)")
    })
    public ResponseEntity<?> process(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(eventBody(orchestrator.process(eventId)));
    }

    private Map<String, Object> eventBody(SecurityEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("eventId", event.getEventId().toString());
        body.put("deviceId", event.getDeviceId());
        body.put("userId", event.getUserId());
        body.put("type", event.getType().name());
        body.put("timestamp", event.getTimestamp().toString());
        body.put("details", event.getDetails());
        body.put("location", event.getLocation().map(LocationRequest::toBody).orElse(null));
        body.put("sessionId", event.getSessionId().orElse(null));
        body.put("processed", event.isProcessed());
        body.put("processedAt", event.getProcessedAt() != null ? event.getProcessedAt().toString() : null);
        body.put("processingError", event.getProcessingError());
        body.put("notifications", event.getOutcomes().stream().map(this::outcomeBody).toList());
        return body;
    }

    private Map<String, Object> outcomeBody(NotificationOutcome o) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", o.channel().name());
        body.put("sent", o.sent());
        if (o.sentAt() != null) body.put("sentAt", o.sentAt().toString());
        if (o.isSkipped()) body.put("skipped", o.skippedReason());
        if (o.isError()) body.put("error", o.error());
        return body;
    }

    @Schema(description = "Security trigger reported by a device")
    public static class ReportAlertRequest {
        @NotBlank(message = "Device id is required")
        public String deviceId;

        @Schema(example = "SIM_CHANGED")
        @NotNull(message = "Alert type is required")
        public AlertType type;

        @Schema(description = "Free-form trigger details", example = "{\"newSimOperator\": \"Carrier X\"}")
        public Map<String, String> details;

        @Valid
        public LocationRequest location;
    }
}
