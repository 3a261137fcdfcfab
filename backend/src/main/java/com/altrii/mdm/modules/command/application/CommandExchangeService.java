package com.altrii.mdm.modules.command.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.altrii.mdm.global.concurrent.DeviceSerialExecutor;
import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.global.plist.PropertyListCodec;
import com.altrii.mdm.modules.audit.application.DeviceEventService;
import com.altrii.mdm.modules.audit.domain.DeviceEventType;
import com.altrii.mdm.modules.command.domain.CommandReport;
import com.altrii.mdm.modules.command.domain.CommandResponseStatus;
import com.altrii.mdm.modules.command.domain.CommandStatus;
import com.altrii.mdm.modules.command.domain.MdmCommand;
import com.altrii.mdm.modules.session.application.SessionRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One round trip on the command endpoint: record the device's answer to the command in
 * flight, then hand out the next queued command, if any.
 */
@Service
public class CommandExchangeService {

    private static final Logger log = LoggerFactory.getLogger(CommandExchangeService.class);

    private final DeviceSerialExecutor serialExecutor;
    private final SessionRegistry sessionRegistry;
    private final CommandQueueService commandQueueService;
    private final CommandReconciler reconciler;
    private final CommandPayloadFactory payloadFactory;
    private final PropertyListCodec codec;
    private final DeviceEventService deviceEventService;

    public CommandExchangeService(
            DeviceSerialExecutor serialExecutor,
            SessionRegistry sessionRegistry,
            CommandQueueService commandQueueService,
            CommandReconciler reconciler,
            CommandPayloadFactory payloadFactory,
            PropertyListCodec codec,
            DeviceEventService deviceEventService
    ) {
        this.serialExecutor = serialExecutor;
        this.sessionRegistry = sessionRegistry;
        this.commandQueueService = commandQueueService;
        this.reconciler = reconciler;
        this.payloadFactory = payloadFactory;
        this.codec = codec;
        this.deviceEventService = deviceEventService;
    }

    /**
     * @return the next command as a property list, or empty when the queue is drained
     */
    public Optional<byte[]> exchange(String deviceId, CommandReport report) {
        return serialExecutor.execute(deviceId, () -> {
            sessionRegistry.find(deviceId)
                    .orElseThrow(() -> new MdmException(MdmErrorCode.NO_SESSION, "No session for device " + deviceId));
            if (!report.isIdle()) {
                recordResponse(deviceId, report);
            }
            return nextRendered(deviceId);
        });
    }

    private void recordResponse(String deviceId, CommandReport report) {
        MdmCommand command = commandQueueService.complete(deviceId, report.commandUuid(), report.status(), report.body());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("commandUUID", command.getCommandUuid().toString());
        detail.put("requestType", command.getRequestType().wireName());
        detail.put("status", report.status().wireName());
        deviceEventService.record(deviceId, DeviceEventType.COMMAND_RESPONSE, detail);

        if (command.getStatus() == CommandStatus.ACKNOWLEDGED) {
            reconciler.onAcknowledged(command, report.body());
        } else {
            log.warn("Device {} answered {} {} with {}", deviceId, command.getRequestType().wireName(),
                    command.getCommandUuid(), report.status().wireName());
            reconciler.onFailed(command);
        }
    }

    private Optional<byte[]> nextRendered(String deviceId) {
        while (true) {
            Optional<MdmCommand> next = commandQueueService.nextCommand(deviceId);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            MdmCommand command = next.get();
            try {
                return Optional.of(codec.encode(payloadFactory.render(command)));
            } catch (MdmException ex) {
                // the profile an InstallProfile pointed at was regenerated since enqueue
                log.warn("Dropping undeliverable {} {} for device {}: {}", command.getRequestType().wireName(),
                        command.getCommandUuid(), deviceId, ex.getDetailMessage());
                commandQueueService.complete(deviceId, command.getCommandUuid(), CommandResponseStatus.ERROR,
                        Map.of("reason", ex.getDetailMessage()));
            }
        }
    }
}
