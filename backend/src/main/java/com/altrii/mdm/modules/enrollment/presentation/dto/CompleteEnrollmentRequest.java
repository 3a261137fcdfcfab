package com.altrii.mdm.modules.enrollment.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record CompleteEnrollmentRequest(
        @NotBlank String deviceId,
        @NotBlank String userId
) {
}
