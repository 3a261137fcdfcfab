package com.altrii.mdm.global.concurrent;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

/**
 * One fair lock per device id. Work for a single device runs one at a time and in arrival
 * order; different devices never contend. A lock lives only while some thread holds or
 * waits for it.
 */
@Component
public class DeviceLockRegistry {

    private final ConcurrentMap<String, HeldLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String deviceId, Supplier<T> work) {
        HeldLock held = locks.compute(deviceId, (id, existing) -> {
            HeldLock entry = existing == null ? new HeldLock() : existing;
            entry.users++;
            return entry;
        });
        held.lock.lock();
        try {
            return work.get();
        } finally {
            held.lock.unlock();
            locks.computeIfPresent(deviceId, (id, entry) -> --entry.users == 0 ? null : entry);
        }
    }

    int size() {
        return locks.size();
    }

    // users is only touched inside compute for its own key
    private static final class HeldLock {

        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
