package com.altrii.mdm.modules.push.domain;

public interface PushGateway {

    PushResult wake(String deviceId, byte[] pushToken, String pushMagic);
}
