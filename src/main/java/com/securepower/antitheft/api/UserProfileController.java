package com.securepower.antitheft.api;

import com.securepower.antitheft.application.DeviceRegistry;
import com.securepower.antitheft.domain.alert.UserProfile;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/users")
@Tag(name = "Trusted Contacts", description = "Who gets alerted, and on which channels")
public class UserProfileController {

    private final DeviceRegistry registry;

    public UserProfileController(DeviceRegistry registry) {
        this.registry = registry;
    }

    @PutMapping("/{userId}/profile")
    @Operation(
        summary = "Save contact profile",
        description = """
        Trusted phone number (SMS), family e-mail addresses (EMAIL), push tokens (PUSH) and channel
        settings. A setting such as "sms": false or "sms.SIM_CHANGED": false turns a channel off.
        """
    )
    public ResponseEntity<?> save(@PathVariable("userId") String userId, @RequestBody @Valid ProfileRequest request) {
        UserProfile saved = registry.saveProfile(new UserProfile(userId, request.name, request.trustedNumber,
                request.familyEmails, request.pushTokens, request.settings));
        return ResponseEntity.ok(body(saved));
    }

    @GetMapping("/{userId}/profile")
    @Operation(summary = "Get contact profile")
    public ResponseEntity<?> get(@PathVariable("userId") String userId) {
        return registry.findProfile(userId)
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok(body(p)))
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "User not found", "message", userId)));
    }

    private Map<String, Object> body(UserProfile p) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", p.getUserId());
        body.put("name", p.getName());
        body.put("trustedNumber", p.getTrustedNumber());
        body.put("familyEmails", p.getFamilyEmails());
        body.put("pushTokens", p.getPushTokens());
        body.put("settings", p.getSettings());
        return body;
    }

    @Schema(description = "Contact profile of a device owner")
    public static class ProfileRequest {
        @Size(max = 200)
        public String name;

        @Schema(description = "E.164 phone number", example = "+15551234567")
        @Size(max = 32)
        public String trustedNumber;

        @Size(max = 10)
        public List<@NotBlank @Email String> familyEmails;

        @Size(max = 20)
        public List<@NotBlank String> pushTokens;

        @Schema(example = "{\"sms\": true, \"push.SIM_CHANGED\": false}")
        public Map<@NotBlank String, @NotNull Boolean> settings;
    }
}
