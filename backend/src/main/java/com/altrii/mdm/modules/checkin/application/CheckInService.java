package com.altrii.mdm.modules.checkin.application;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.altrii.mdm.global.concurrent.DeviceSerialExecutor;
import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.modules.audit.application.DeviceEventService;
import com.altrii.mdm.modules.audit.domain.DeviceEventType;
import com.altrii.mdm.modules.checkin.domain.CheckInMessage;
import com.altrii.mdm.modules.command.application.CommandQueueService;
import com.altrii.mdm.modules.device.domain.DeviceRecord;
import com.altrii.mdm.modules.device.infrastructure.persistence.DeviceRecordRepository;
import com.altrii.mdm.modules.push.domain.WakeRequested;
import com.altrii.mdm.modules.session.application.SessionRegistry;
import com.altrii.mdm.modules.session.domain.DeviceSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Drives the enrollment state machine: Authenticate opens a session, TokenUpdate refreshes
 * push credentials, CheckOut ends it. Each message runs under the device lock in its own
 * transaction.
 */
@Service
public class CheckInService {

    private static final Logger log = LoggerFactory.getLogger(CheckInService.class);

    private final DeviceSerialExecutor serialExecutor;
    private final DeviceRecordRepository deviceRecordRepository;
    private final SessionRegistry sessionRegistry;
    private final CommandQueueService commandQueueService;
    private final DeviceEventService deviceEventService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public CheckInService(
            DeviceSerialExecutor serialExecutor,
            DeviceRecordRepository deviceRecordRepository,
            SessionRegistry sessionRegistry,
            CommandQueueService commandQueueService,
            DeviceEventService deviceEventService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.serialExecutor = serialExecutor;
        this.deviceRecordRepository = deviceRecordRepository;
        this.sessionRegistry = sessionRegistry;
        this.commandQueueService = commandQueueService;
        this.deviceEventService = deviceEventService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public void handle(String deviceId, CheckInMessage message) {
        if (message.kind() == CheckInMessage.Kind.AUTHENTICATE
                && deviceRecordRepository.findByDeviceId(deviceId).isEmpty()) {
            throw new MdmException(MdmErrorCode.UNKNOWN_DEVICE, "Unknown device " + deviceId);
        }
        serialExecutor.run(deviceId, () -> {
            switch (message.kind()) {
                case AUTHENTICATE -> authenticate(deviceId, (CheckInMessage.Authenticate) message);
                case TOKEN_UPDATE -> tokenUpdate(deviceId, (CheckInMessage.TokenUpdate) message);
                case CHECK_OUT -> checkOut(deviceId, (CheckInMessage.CheckOut) message);
            }
        });
    }

    private void authenticate(String deviceId, CheckInMessage.Authenticate message) {
        DeviceSession authenticated = DeviceSession.authenticated(deviceId, message.udid(), message.serialNumber(),
                message.model(), message.osVersion(), message.buildVersion(), message.supervised(), now());
        DeviceSession session = sessionRegistry.find(deviceId)
                .map(existing -> existing.withAuthentication(authenticated))
                .orElse(authenticated);
        sessionRegistry.upsert(session);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("supervised", message.supervised());
        detail.put("osVersion", message.osVersion());
        deviceEventService.record(deviceId, DeviceEventType.AUTHENTICATED, detail);
        log.info("Device {} authenticated (udid {}, supervised {})", deviceId, message.udid(), message.supervised());
    }

    private void tokenUpdate(String deviceId, CheckInMessage.TokenUpdate message) {
        DeviceSession session = sessionRegistry.find(deviceId)
                .orElseThrow(() -> new MdmException(MdmErrorCode.NO_SESSION, "TokenUpdate before Authenticate"));
        DeviceSession updated = sessionRegistry.upsert(
                session.withTokens(message.token(), message.pushMagic(), message.unlockToken(), now()));
        deviceEventService.record(deviceId, DeviceEventType.TOKEN_UPDATED, Map.of());

        if (commandQueueService.hasPending(deviceId)) {
            eventPublisher.publishEvent(
                    new WakeRequested(deviceId, updated.pushToken(), updated.pushMagic(), "token_update"));
        }
        log.info("Device {} updated its push token", deviceId);
    }

    private void checkOut(String deviceId, CheckInMessage.CheckOut message) {
        Optional<DeviceSession> session = sessionRegistry.find(deviceId);
        if (session.isEmpty()) {
            log.debug("CheckOut from device {} without a session", deviceId);
            return;
        }
        sessionRegistry.remove(deviceId);
        deviceRecordRepository.findByDeviceId(deviceId).ifPresent(DeviceRecord::unenroll);
        deviceEventService.record(deviceId, DeviceEventType.UNENROLLED, Map.of("reason", message.reason()));
        log.info("Device {} checked out: {}", deviceId, message.reason());
    }

    private Instant now() {
        return clock.instant();
    }
}
