package com.altrii.mdm.modules.supervision.presentation.dto;

import java.time.OffsetDateTime;

public record DeviceStatusResponse(
        String deviceId,
        boolean online,
        OffsetDateTime lastCheckIn,
        boolean supervised,
        long pendingCommands,
        boolean profileInstalled,
        int securityLevel,
        DeviceInfo deviceInfo
) {

    public record DeviceInfo(String model, String osVersion, String serialNumber) {
    }
}
