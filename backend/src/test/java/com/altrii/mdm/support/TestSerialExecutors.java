package com.altrii.mdm.support;

import com.altrii.mdm.global.concurrent.DeviceLockRegistry;
import com.altrii.mdm.global.concurrent.DeviceSerialExecutor;

import org.springframework.transaction.support.TransactionTemplate;

/**
 * Serial executor backed by real per-device locks and an in-memory transaction manager.
 */
public final class TestSerialExecutors {

    private TestSerialExecutors() {
    }

    public static DeviceSerialExecutor direct() {
        return new DeviceSerialExecutor(
                new DeviceLockRegistry(),
                new TransactionTemplate(new InMemoryTransactionManager())
        );
    }
}
