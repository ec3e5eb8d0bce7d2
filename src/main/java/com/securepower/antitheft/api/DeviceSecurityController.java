// ==============================================================================
// Device Security API - registration, credentials and verification
// File: src/main/java/com/securepower/antitheft/api/DeviceSecurityController.java
// ==============================================================================

package com.securepower.antitheft.api;

import com.securepower.antitheft.api.dto.LocationRequest;
import com.securepower.antitheft.application.AuthGate;
import com.securepower.antitheft.application.CredentialStore;
import com.securepower.antitheft.application.DeviceRegistry;
import com.securepower.antitheft.domain.credential.AttemptState;
import com.securepower.antitheft.domain.credential.AuthOutcome;
import com.securepower.antitheft.domain.credential.CredentialKind;
import com.securepower.antitheft.domain.device.DeviceRecord;
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
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/devices")
@Tag(name = "Device Security", description = "Device registration, PIN/password setup and verification")
public class DeviceSecurityController {

    private static final Logger log = LoggerFactory.getLogger(DeviceSecurityController.class);

    private final DeviceRegistry registry;
    private final CredentialStore credentialStore;
    private final AuthGate authGate;
    private final Clock clock;

    public DeviceSecurityController(DeviceRegistry registry, CredentialStore credentialStore,
                                    AuthGate authGate, Clock clock) {
        this.registry = registry;
        this.credentialStore = credentialStore;
        this.authGate = authGate;
        this.clock = clock;
    }

    // ==========================================================================
    // DEVICE REGISTRATION
    // ==========================================================================

    @PostMapping
    @Operation(summary = "Register a device", description = "Registers a device for an owner, or renames it if already known.")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Device registered"),
        @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<?> register(@RequestBody @Valid RegisterDeviceRequest request) {
        DeviceRecord device = registry.register(request.deviceId, request.userId, request.deviceName, request.model);
        return ResponseEntity.status(HttpStatus.CREATED).body(deviceBody(device));
    }

    @GetMapping("/{deviceId}")
    @Operation(summary = "Get device status", description = "Status projection: current status, last alert and last known location.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device found"),
        @ApiResponse(responseCode = "404", description = "Unknown device")
    })
    public ResponseEntity<?> get(@PathVariable("deviceId") String deviceId) {
        return ResponseEntity.ok(deviceBody(registry.get(deviceId)));
    }

    // ==========================================================================
    // CREDENTIALS
    // ==========================================================================

    @PutMapping("/{deviceId}/credentials/{kind}")
    @Operation(
        summary = "Set up or change a PIN or password",
        description = """
        Stores a salted PBKDF2 hash of the credential. PIN: 4-6 digits. PASSWORD: at least 8 characters.
        A device without credentials accepts a first-time setup. Once a PIN or password exists, the request
        must carry currentKind/currentValue, which are checked like a verification attempt.
        """
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Credential stored"),
        @ApiResponse(responseCode = "400", description = "Credential does not satisfy the format"),
        @ApiResponse(responseCode = "401", description = "Current credential rejected"),
        @ApiResponse(responseCode = "409", description = "Credentials already configured and no current credential given"),
        @ApiResponse(responseCode = "423", description = "Verification locked out")
    })
    public ResponseEntity<?> setupCredential(@PathVariable("deviceId") String deviceId,
                                             @PathVariable("kind") CredentialKind kind,
                                             @RequestBody @Valid CredentialRequest request) {
        if (request.currentValue == null) {
            credentialStore.setup(deviceId, kind, request.value);
            return ResponseEntity.ok(Map.of("deviceId", deviceId, "kind", kind.name(), "configured", true));
        }

        CredentialKind currentKind = request.currentKind != null ? request.currentKind : kind;
        AuthOutcome outcome = authGate.changeCredential(deviceId, currentKind, request.currentValue, kind, request.value);
        log.info("Credential change for device {} -> {}", deviceId, outcome.status());
        if (outcome instanceof AuthOutcome.Success) {
            return ResponseEntity.ok(Map.of("deviceId", deviceId, "kind", kind.name(), "configured", true));
        }
        return outcomeResponse(outcome);
    }

    @PostMapping("/{deviceId}/credentials/reset")
    @Operation(
        summary = "Reset credentials",
        description = """
        Account recovery: removes PIN and password once either one verifies. The failed-attempt
        history is only cleared by that successful verification.
        """
    )
    public ResponseEntity<?> resetCredentials(@PathVariable("deviceId") String deviceId,
                                              @RequestBody @Valid VerifyRequest request) {
        AuthOutcome outcome = authGate.resetCredentials(deviceId, request.kind, request.value);
        log.info("Credential reset for device {} -> {}", deviceId, outcome.status());
        if (outcome instanceof AuthOutcome.Success) {
            return ResponseEntity.ok(Map.of("deviceId", deviceId, "reset", true));
        }
        return outcomeResponse(outcome);
    }

    // ==========================================================================
    // VERIFICATION
    // ==========================================================================

    @PostMapping("/{deviceId}/verify")
    @Operation(
        summary = "Verify a credential",
        description = """
        Checks a PIN or password. The third consecutive failure raises a FAILED_AUTH_THRESHOLD
        security alert and locks verification for 30 seconds.
        """
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Credential accepted",
            content = @Content(mediaType = "application/json", examples = @ExampleObject(value = """
            { "status": "SUCCESS" }
            """))),
        @ApiResponse(responseCode = "401", description = "Credential rejected",
            content = @Content(mediaType = "application/json", examples = @ExampleObject(value = """
            { "status": "FAILED_WITH_ALERT", "attemptCount": 3, "lockoutSeconds": 30 }
            """))),
        @ApiResponse(responseCode = "409", description = "No credential of that kind configured"),
        @ApiResponse(responseCode = "423", description = "Verification locked out")
    })
    public ResponseEntity<?> verify(@PathVariable("deviceId") String deviceId,
                                    @RequestBody @Valid VerifyRequest request) {
        AuthOutcome outcome = authGate.verify(deviceId, request.kind, request.value);
        log.info("Verification for device {} -> {}", deviceId, outcome.status());
        return outcomeResponse(outcome);
    }

    @GetMapping("/{deviceId}/auth-status")
    @Operation(summary = "Get attempt state", description = "Failed attempts since the last success and any active lockout.")
    public ResponseEntity<?> authStatus(@PathVariable("deviceId") String deviceId) {
        AttemptState state = authGate.status(deviceId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("deviceId", deviceId);
        body.put("failedCount", state.getFailedCount());
        body.put("lockedOut", state.isLockedOut(clock.instant()));
        body.put("remainingSeconds", state.remainingLockoutSeconds(clock.instant()));
        body.put("lastAttemptAt", state.getLastAttemptAt() != null ? state.getLastAttemptAt().toString() : null);
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<?> outcomeResponse(AuthOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", outcome.status());
        HttpStatus status;
        if (outcome instanceof AuthOutcome.Success) {
            status = HttpStatus.OK;
        } else if (outcome instanceof AuthOutcome.NotConfigured) {
            status = HttpStatus.CONFLICT;
        } else if (outcome instanceof AuthOutcome.LockedOut locked) {
            body.put("remainingSeconds", locked.remainingSeconds());
            status = HttpStatus.LOCKED;
        } else if (outcome instanceof AuthOutcome.FailedWithAlert alert) {
            body.put("attemptCount", alert.attemptCount());
            body.put("lockoutSeconds", alert.lockoutSeconds());
            status = HttpStatus.UNAUTHORIZED;
        } else if (outcome instanceof AuthOutcome.FailedAtThreshold warning) {
            body.put("attemptCount", warning.attemptCount());
            body.put("warning", "The next failed attempt triggers a security alert");
            status = HttpStatus.UNAUTHORIZED;
        } else {
            body.put("attemptCount", ((AuthOutcome.Failed) outcome).attemptCount());
            status = HttpStatus.UNAUTHORIZED;
        }
        return ResponseEntity.status(status).body(body);
    }

    private Map<String, Object> deviceBody(DeviceRecord device) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("deviceId", device.getDeviceId());
        body.put("userId", device.getUserId());
        body.put("deviceName", device.getDeviceName());
        body.put("model", device.getModel());
        body.put("status", device.getStatus().name());
        body.put("lastAlert", device.getLastAlert() != null ? device.getLastAlert().toString() : null);
        body.put("lastAlertType", device.getLastAlertType() != null ? device.getLastAlertType().name() : null);
        body.put("lastLocation", device.getLastLocation() != null ? LocationRequest.toBody(device.getLastLocation()) : null);
        return body;
    }

    // ==========================================================================
    // REQUEST DTOs
    // ==========================================================================

    @Schema(description = "Device registration request")
    public static class RegisterDeviceRequest {
        @Schema(example = "device-7f3a")
        @NotBlank(message = "Device id is required")
        @Size(max = 128)
        public String deviceId;

        @Schema(example = "user-42")
        @NotBlank(message = "User id is required")
        @Size(max = 128)
        public String userId;

        @Schema(example = "Pixel 8")
        @Size(max = 200)
        public String deviceName;

        @Size(max = 200)
        public String model;
    }

    @Schema(description = "Credential setup or change request")
    public static class CredentialRequest {
        @Schema(description = "The new PIN or password", example = "1234")
        @NotBlank(message = "Credential value is required")
        @Size(max = 256)
        public String value;

        @Schema(description = "Kind of the existing credential being proven; defaults to the kind being set", example = "PIN")
        public CredentialKind currentKind;

        @Schema(description = "Existing PIN or password, required once the device has credentials")
        @Size(max = 256)
        public String currentValue;
    }

    @Schema(description = "Credential verification request")
    public static class VerifyRequest {
        @Schema(example = "PIN")
        @NotNull(message = "Credential kind is required")
        public CredentialKind kind;

        @NotBlank(message = "Credential value is required")
        @Size(max = 256)
        public String value;
    }
}
