package com.altrii.mdm.modules.session.domain;

import java.util.Optional;

public interface SessionStore {

    Optional<DeviceSession> find(String deviceId);

    void save(DeviceSession session);

    void remove(String deviceId);

    long count();
}
