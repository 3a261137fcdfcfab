package com.altrii.mdm.modules.supervision.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record GenerateProfileRequest(
        @NotBlank String deviceId,
        @NotBlank String userId,
        @NotNull Integer securityLevel,
        @Valid BlockingSettingsRequest settings,
        Boolean webOnly
) {
}
