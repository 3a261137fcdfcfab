package com.altrii.mdm.modules.enrollment.domain;

import java.time.Instant;
import java.util.UUID;

public record EnrollmentTicket(
        String code,
        byte[] profileBytes,
        String deviceId,
        String userId,
        UUID profileUuid,
        Instant expiresAt,
        TicketState state
) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public EnrollmentTicket downloaded() {
        return new EnrollmentTicket(code, profileBytes, deviceId, userId, profileUuid, expiresAt, TicketState.DOWNLOADED);
    }
}
