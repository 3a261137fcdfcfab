package com.altrii.mdm.global.web;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.modules.profile.application.ProfileSigner;
import com.altrii.mdm.modules.session.application.SessionRegistry;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MdmHealthController {

    private final SessionRegistry sessionRegistry;
    private final ProfileSigner profileSigner;
    private final MdmProperties properties;
    private final Clock clock;

    public MdmHealthController(SessionRegistry sessionRegistry, ProfileSigner profileSigner,
                               MdmProperties properties, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.profileSigner = profileSigner;
        this.properties = properties;
        this.clock = clock;
    }

    @Operation(summary = "Protocol engine health")
    @GetMapping("/mdm/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse(
                "healthy",
                sessionRegistry.activeSessionCount(),
                properties.getStore().getType(),
                profileSigner.signingAvailable(),
                OffsetDateTime.now(clock)));
    }

    public record HealthResponse(
            String status,
            long activeSessions,
            String storeType,
            boolean signingAvailable,
            OffsetDateTime timestamp
    ) {
    }
}
