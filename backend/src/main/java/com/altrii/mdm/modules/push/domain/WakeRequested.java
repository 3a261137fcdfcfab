package com.altrii.mdm.modules.push.domain;

public record WakeRequested(
        String deviceId,
        byte[] pushToken,
        String pushMagic,
        String reason
) {
}
