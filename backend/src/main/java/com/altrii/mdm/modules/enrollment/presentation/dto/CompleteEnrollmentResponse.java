package com.altrii.mdm.modules.enrollment.presentation.dto;

import java.time.OffsetDateTime;

public record CompleteEnrollmentResponse(
        boolean success,
        String status,
        OffsetDateTime enrolledAt
) {
}
