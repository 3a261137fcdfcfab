package com.altrii.mdm.modules.command.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.global.error.RetryableProblemException;
import com.altrii.mdm.modules.audit.application.DeviceEventService;
import com.altrii.mdm.modules.audit.domain.DeviceEventType;
import com.altrii.mdm.modules.command.domain.CommandQueueStore;
import com.altrii.mdm.modules.command.domain.CommandResponseStatus;
import com.altrii.mdm.modules.command.domain.CommandStatus;
import com.altrii.mdm.modules.command.domain.MdmCommand;
import com.altrii.mdm.modules.command.domain.RequestType;
import com.altrii.mdm.modules.command.infrastructure.persistence.MdmCommandRepository;
import com.altrii.mdm.modules.device.domain.DeviceRecord;
import com.altrii.mdm.modules.device.infrastructure.persistence.DeviceRecordRepository;
import com.altrii.mdm.modules.entitlement.application.EntitlementDirectory;
import com.altrii.mdm.modules.entitlement.domain.EntitlementTier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-device FIFO of commands. The live queue holds ids in enqueue order and the command
 * table is the source of truth: the head is always the oldest outstanding row. Every method
 * expects the caller to hold the device lock.
 */
@Service
@Transactional
public class CommandQueueService {

    private static final Logger log = LoggerFactory.getLogger(CommandQueueService.class);

    static final int QUEUE_FULL_RETRY_AFTER_SECONDS = 60;

    private final MdmCommandRepository commandRepository;
    private final CommandQueueStore queueStore;
    private final DeviceRecordRepository deviceRecordRepository;
    private final EntitlementDirectory entitlementDirectory;
    private final CommandPayloadFactory payloadFactory;
    private final DeviceEventService deviceEventService;
    private final Clock clock;

    public CommandQueueService(
            MdmCommandRepository commandRepository,
            CommandQueueStore queueStore,
            DeviceRecordRepository deviceRecordRepository,
            EntitlementDirectory entitlementDirectory,
            CommandPayloadFactory payloadFactory,
            DeviceEventService deviceEventService,
            Clock clock
    ) {
        this.commandRepository = commandRepository;
        this.queueStore = queueStore;
        this.deviceRecordRepository = deviceRecordRepository;
        this.entitlementDirectory = entitlementDirectory;
        this.payloadFactory = payloadFactory;
        this.deviceEventService = deviceEventService;
        this.clock = clock;
    }

    public MdmCommand enqueue(String deviceId, RequestType requestType, Map<String, Object> parameters) {
        DeviceRecord device = deviceRecordRepository.findByDeviceId(deviceId)
                .orElseThrow(() -> new MdmException(MdmErrorCode.DEVICE_NOT_FOUND));
        Map<String, Object> payload = payloadFactory.normalize(deviceId, requestType, parameters);

        EntitlementTier tier = entitlementDirectory.tierFor(device.getUserId(), deviceId);
        long outstanding = commandRepository.countByDeviceIdAndStatusIn(deviceId, CommandStatus.OUTSTANDING);
        if (outstanding >= tier.maxOutstandingCommands()) {
            throw new RetryableProblemException(
                    MdmErrorCode.COMMAND_QUEUE_FULL.status(),
                    MdmErrorCode.COMMAND_QUEUE_FULL.name(),
                    "Device " + deviceId + " already has " + outstanding + " outstanding commands (" + tier + " limit "
                            + tier.maxOutstandingCommands() + ")",
                    QUEUE_FULL_RETRY_AFTER_SECONDS
            );
        }

        syncLiveQueue(deviceId);
        MdmCommand command = commandRepository.save(MdmCommand.pending(deviceId, requestType, payload));
        queueStore.append(deviceId, command.getCommandUuid());
        log.info("Queued {} {} for device {}", requestType.wireName(), command.getCommandUuid(), deviceId);
        return command;
    }

    /**
     * Head of the device's queue, marked SENT. A command already in flight is handed out
     * again until the device answers it.
     */
    public Optional<MdmCommand> nextCommand(String deviceId) {
        Optional<MdmCommand> head = head(deviceId);
        head.ifPresent(command -> command.markSent(now()));
        return head;
    }

    @Transactional(readOnly = true)
    public boolean hasPending(String deviceId) {
        return commandRepository.countByDeviceIdAndStatusIn(deviceId, CommandStatus.OUTSTANDING) > 0;
    }

    @Transactional(readOnly = true)
    public long outstandingCount(String deviceId) {
        return commandRepository.countByDeviceIdAndStatusIn(deviceId, CommandStatus.OUTSTANDING);
    }

    public MdmCommand cancel(String deviceId, UUID commandUuid) {
        MdmCommand command = commandRepository.findByCommandUuid(commandUuid)
                .filter(candidate -> candidate.getDeviceId().equals(deviceId))
                .orElseThrow(() -> new MdmException(MdmErrorCode.COMMAND_NOT_FOUND));
        if (command.getStatus() == CommandStatus.CANCELLED) {
            return command;
        }
        if (command.getStatus() != CommandStatus.PENDING) {
            throw new MdmException(MdmErrorCode.COMMAND_ALREADY_SENT,
                    "Command " + commandUuid + " is " + command.getStatus());
        }
        command.cancel();
        queueStore.remove(deviceId, commandUuid);
        deviceEventService.record(deviceId, DeviceEventType.COMMAND_CANCELLED, Map.of(
                "commandUUID", commandUuid.toString(),
                "requestType", command.getRequestType().wireName()
        ));
        log.info("Cancelled {} {} for device {}", command.getRequestType().wireName(), commandUuid, deviceId);
        return command;
    }

    /**
     * Records the device's answer to the command at the head of its queue and drops it from
     * the queue. Any id other than the head is rejected without touching the queue.
     */
    public MdmCommand complete(String deviceId, UUID commandUuid, CommandResponseStatus status,
                               Map<String, Object> response) {
        MdmCommand command = head(deviceId)
                .filter(candidate -> candidate.getCommandUuid().equals(commandUuid))
                .orElseThrow(() -> new MdmException(MdmErrorCode.UNKNOWN_COMMAND,
                        "Command " + commandUuid + " is not in flight for device " + deviceId));
        if (status == CommandResponseStatus.ACKNOWLEDGED) {
            command.acknowledge(now(), response);
        } else {
            command.fail(status, now(), response);
        }
        queueStore.remove(deviceId, commandUuid);
        return command;
    }

    private Optional<MdmCommand> head(String deviceId) {
        return syncLiveQueue(deviceId).stream().findFirst();
    }

    /**
     * Outstanding rows in enqueue order. The live queue is replaced whenever it disagrees
     * with them, which covers a cold store as well as live writes that outlived a rolled
     * back transaction.
     */
    private List<MdmCommand> syncLiveQueue(String deviceId) {
        List<MdmCommand> outstanding = commandRepository
                .findByDeviceIdAndStatusInOrderByIdAsc(deviceId, CommandStatus.OUTSTANDING);
        List<UUID> ids = outstanding.stream()
                .map(MdmCommand::getCommandUuid)
                .toList();
        if (!queueStore.snapshot(deviceId).equals(ids)) {
            log.debug("Rebuilding live queue for device {} from {} outstanding commands", deviceId, ids.size());
            queueStore.replace(deviceId, ids);
        }
        return outstanding;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
