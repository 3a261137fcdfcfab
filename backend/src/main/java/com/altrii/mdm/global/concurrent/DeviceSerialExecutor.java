package com.altrii.mdm.global.concurrent;

import java.util.function.Supplier;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs protocol work for one device under that device's lock, inside a transaction opened
 * after the lock is held, so durable writes commit in the order messages arrived.
 */
@Component
public class DeviceSerialExecutor {

    private final DeviceLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;

    public DeviceSerialExecutor(DeviceLockRegistry lockRegistry, TransactionTemplate transactionTemplate) {
        this.lockRegistry = lockRegistry;
        this.transactionTemplate = transactionTemplate;
    }

    public <T> T execute(String deviceId, Supplier<T> work) {
        return lockRegistry.withLock(deviceId, () -> transactionTemplate.execute(status -> work.get()));
    }

    public void run(String deviceId, Runnable work) {
        execute(deviceId, () -> {
            work.run();
            return null;
        });
    }
}
