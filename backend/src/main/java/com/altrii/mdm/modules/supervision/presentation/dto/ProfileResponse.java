package com.altrii.mdm.modules.supervision.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record ProfileResponse(
        UUID profileUUID,
        String deviceId,
        String profileIdentifier,
        String displayName,
        int securityLevel,
        boolean signed,
        boolean installed,
        OffsetDateTime installDate,
        OffsetDateTime updatedAt,
        Map<String, Object> contentFilter,
        Map<String, Object> restrictions
) {
}
