package com.altrii.mdm.modules.session.domain;

import java.time.Instant;

/**
 * Live state of an enrolled device between Authenticate and CheckOut. Immutable; updates
 * produce a new value.
 */
public record DeviceSession(
        String deviceId,
        String udid,
        byte[] pushToken,
        String pushMagic,
        byte[] unlockToken,
        String osVersion,
        String buildVersion,
        String model,
        String serialNumber,
        boolean supervised,
        Instant lastCheckIn
) {

    public static DeviceSession authenticated(
            String deviceId,
            String udid,
            String serialNumber,
            String model,
            String osVersion,
            String buildVersion,
            boolean supervised,
            Instant checkedInAt
    ) {
        return new DeviceSession(deviceId, udid, null, null, null, osVersion, buildVersion, model,
                serialNumber, supervised, checkedInAt);
    }

    public DeviceSession withAuthentication(DeviceSession authenticated) {
        // a repeated Authenticate keeps the push credentials from the last TokenUpdate
        return new DeviceSession(deviceId, authenticated.udid(), pushToken, pushMagic, unlockToken,
                authenticated.osVersion(), authenticated.buildVersion(), authenticated.model(),
                authenticated.serialNumber(), authenticated.supervised(), authenticated.lastCheckIn());
    }

    public DeviceSession withTokens(byte[] token, String magic, byte[] unlock, Instant checkedInAt) {
        return new DeviceSession(deviceId, udid, token, magic, unlock != null ? unlock : unlockToken,
                osVersion, buildVersion, model, serialNumber, supervised, checkedInAt);
    }

    public DeviceSession withSupervised(boolean value) {
        return new DeviceSession(deviceId, udid, pushToken, pushMagic, unlockToken, osVersion,
                buildVersion, model, serialNumber, value, lastCheckIn);
    }

    public boolean canBeWoken() {
        return pushToken != null && pushToken.length > 0 && pushMagic != null && !pushMagic.isBlank();
    }
}
