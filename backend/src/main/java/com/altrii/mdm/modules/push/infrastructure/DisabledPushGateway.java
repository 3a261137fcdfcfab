package com.altrii.mdm.modules.push.infrastructure;

import com.altrii.mdm.modules.push.domain.PushGateway;
import com.altrii.mdm.modules.push.domain.PushResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "mdm.apns.enabled", havingValue = "false", matchIfMissing = true)
public class DisabledPushGateway implements PushGateway {

    private static final Logger log = LoggerFactory.getLogger(DisabledPushGateway.class);

    @Override
    public PushResult wake(String deviceId, byte[] pushToken, String pushMagic) {
        log.warn("APNs not configured, cannot wake device {}", deviceId);
        return PushResult.skipped("apns disabled");
    }
}
