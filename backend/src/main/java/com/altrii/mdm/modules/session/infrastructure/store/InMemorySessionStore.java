package com.altrii.mdm.modules.session.infrastructure.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.altrii.mdm.modules.session.domain.DeviceSession;
import com.altrii.mdm.modules.session.domain.SessionStore;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "mdm.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentMap<String, DeviceSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<DeviceSession> find(String deviceId) {
        return Optional.ofNullable(sessions.get(deviceId));
    }

    @Override
    public void save(DeviceSession session) {
        sessions.put(session.deviceId(), session);
    }

    @Override
    public void remove(String deviceId) {
        sessions.remove(deviceId);
    }

    @Override
    public long count() {
        return sessions.size();
    }
}
