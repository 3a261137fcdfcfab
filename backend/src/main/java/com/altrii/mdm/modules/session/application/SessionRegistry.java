package com.altrii.mdm.modules.session.application;

import java.util.Optional;

import com.altrii.mdm.global.transaction.AfterCommit;
import com.altrii.mdm.modules.session.domain.DeviceSession;
import com.altrii.mdm.modules.session.domain.DeviceSessionRecord;
import com.altrii.mdm.modules.session.domain.SessionStore;
import com.altrii.mdm.modules.session.infrastructure.persistence.DeviceSessionRecordRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the durable session row and the live store in step. Live writes are applied only
 * once the surrounding transaction commits, so a rolled back check-in leaves no live
 * session behind.
 */
@Service
@Transactional
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final DeviceSessionRecordRepository sessionRecordRepository;
    private final SessionStore sessionStore;

    public SessionRegistry(DeviceSessionRecordRepository sessionRecordRepository, SessionStore sessionStore) {
        this.sessionRecordRepository = sessionRecordRepository;
        this.sessionStore = sessionStore;
    }

    public DeviceSession upsert(DeviceSession session) {
        DeviceSessionRecord record = sessionRecordRepository.findById(session.deviceId())
                .orElseGet(() -> new DeviceSessionRecord(session.deviceId()));
        record.apply(session);
        sessionRecordRepository.save(record);
        AfterCommit.run(() -> sessionStore.save(session));
        return session;
    }

    /**
     * Live session, falling back to the durable row after a restart or eviction of the
     * live store.
     */
    @Transactional(readOnly = true)
    public Optional<DeviceSession> find(String deviceId) {
        Optional<DeviceSession> live = sessionStore.find(deviceId);
        if (live.isPresent()) {
            return live;
        }
        Optional<DeviceSession> durable = sessionRecordRepository.findById(deviceId)
                .map(DeviceSessionRecord::toSession);
        durable.ifPresent(session -> {
            log.debug("Restored live session for device {} from the durable row", deviceId);
            AfterCommit.run(() -> sessionStore.save(session));
        });
        return durable;
    }

    public void remove(String deviceId) {
        sessionRecordRepository.deleteById(deviceId);
        AfterCommit.run(() -> sessionStore.remove(deviceId));
    }

    public void markSupervised(String deviceId, boolean supervised) {
        sessionRecordRepository.findById(deviceId).ifPresent(record -> record.setSupervised(supervised));
        AfterCommit.run(() -> sessionStore.find(deviceId)
                .ifPresent(session -> sessionStore.save(session.withSupervised(supervised))));
    }

    @Transactional(readOnly = true)
    public long activeSessionCount() {
        return sessionStore.count();
    }
}
