package com.altrii.mdm.modules.supervision.presentation.dto;

import java.util.List;
import java.util.UUID;

public record VerificationResponse(
        boolean verificationInitiated,
        int commandsSent,
        List<UUID> commandUUIDs,
        boolean wakeRequested
) {
}
