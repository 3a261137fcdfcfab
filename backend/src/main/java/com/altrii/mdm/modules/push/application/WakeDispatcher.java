package com.altrii.mdm.modules.push.application;

import com.altrii.mdm.global.config.AsyncConfig;
import com.altrii.mdm.modules.push.domain.PushGateway;
import com.altrii.mdm.modules.push.domain.PushResult;
import com.altrii.mdm.modules.push.domain.WakeRequested;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers wake requests once the state change that produced them has committed. Runs off
 * the request thread; results are logged only.
 */
@Component
public class WakeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WakeDispatcher.class);

    private final PushGateway pushGateway;

    public WakeDispatcher(PushGateway pushGateway) {
        this.pushGateway = pushGateway;
    }

    @Async(AsyncConfig.WAKE_DISPATCH_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onWakeRequested(WakeRequested event) {
        dispatch(event);
    }

    public PushResult dispatch(WakeRequested event) {
        if (event.pushToken() == null || event.pushToken().length == 0 || event.pushMagic() == null) {
            log.debug("Device {} has no push credentials yet; waiting for its next check-in", event.deviceId());
            return PushResult.skipped("no push credentials");
        }
        try {
            PushResult result = pushGateway.wake(event.deviceId(), event.pushToken(), event.pushMagic());
            if (!result.delivered()) {
                log.warn("Wake for device {} ({}) not delivered: {}", event.deviceId(), event.reason(),
                        result.failureReason());
            }
            return result;
        } catch (RuntimeException ex) {
            log.error("Wake for device {} failed", event.deviceId(), ex);
            return PushResult.rejected(0, ex.getMessage());
        }
    }
}
