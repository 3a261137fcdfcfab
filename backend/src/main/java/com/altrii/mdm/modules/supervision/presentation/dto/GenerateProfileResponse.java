package com.altrii.mdm.modules.supervision.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record GenerateProfileResponse(
        String enrollmentCode,
        UUID profileUUID,
        String downloadUrl,
        OffsetDateTime expiresAt,
        boolean signed
) {
}
