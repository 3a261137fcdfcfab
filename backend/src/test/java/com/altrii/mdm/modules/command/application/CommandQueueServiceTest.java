package com.altrii.mdm.modules.command.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.global.error.RetryableProblemException;
import com.altrii.mdm.modules.audit.application.DeviceEventService;
import com.altrii.mdm.modules.audit.domain.DeviceEventType;
import com.altrii.mdm.modules.command.domain.CommandResponseStatus;
import com.altrii.mdm.modules.command.domain.CommandStatus;
import com.altrii.mdm.modules.command.domain.MdmCommand;
import com.altrii.mdm.modules.command.domain.RequestType;
import com.altrii.mdm.modules.command.infrastructure.store.InMemoryCommandQueueStore;
import com.altrii.mdm.modules.device.domain.DeviceRecord;
import com.altrii.mdm.modules.device.infrastructure.persistence.DeviceRecordRepository;
import com.altrii.mdm.modules.entitlement.application.EntitlementDirectory;
import com.altrii.mdm.modules.entitlement.domain.EntitlementTier;
import com.altrii.mdm.modules.profile.infrastructure.persistence.SupervisionProfileRepository;
import com.altrii.mdm.support.CommandTable;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class CommandQueueServiceTest {

    private static final String DEVICE = "7f1c2a44-0b7e-4d7a-9a53-3d4c1c0f0001";
    private static final String OTHER_DEVICE = "7f1c2a44-0b7e-4d7a-9a53-3d4c1c0f0002";

    @Mock
    private DeviceRecordRepository deviceRecordRepository;

    @Mock
    private EntitlementDirectory entitlementDirectory;

    @Mock
    private SupervisionProfileRepository supervisionProfileRepository;

    @Mock
    private DeviceEventService deviceEventService;

    private CommandTable commandTable;
    private InMemoryCommandQueueStore queueStore;
    private CommandQueueService commandQueueService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        commandTable = new CommandTable();
        queueStore = new InMemoryCommandQueueStore();
        commandQueueService = newService(queueStore, clock);

        lenient().when(deviceRecordRepository.findByDeviceId(anyString()))
                .thenAnswer(invocation -> Optional.of(device(invocation.getArgument(0))));
        lenient().when(entitlementDirectory.tierFor(anyString(), anyString())).thenReturn(EntitlementTier.PREMIUM);
    }

    @Test
    @DisplayName("nextCommand hands out a device's commands in enqueue order")
    void nextCommand_followsEnqueueOrder() {
        MdmCommand first = commandQueueService.enqueue(DEVICE, RequestType.PROFILE_LIST, Map.of());
        MdmCommand second = commandQueueService.enqueue(DEVICE, RequestType.SECURITY_INFO, Map.of());

        assertThat(commandQueueService.nextCommand(DEVICE)).contains(first);
        assertThat(first.getStatus()).isEqualTo(CommandStatus.SENT);
        // still in flight, so it is handed out again
        assertThat(commandQueueService.nextCommand(DEVICE)).contains(first);

        commandQueueService.complete(DEVICE, first.getCommandUuid(), CommandResponseStatus.ACKNOWLEDGED, Map.of());

        assertThat(first.getStatus()).isEqualTo(CommandStatus.ACKNOWLEDGED);
        assertThat(commandQueueService.nextCommand(DEVICE)).contains(second);
    }

    @Test
    @DisplayName("queues of different devices never mix")
    void nextCommand_isolatesDevices() {
        MdmCommand mine = commandQueueService.enqueue(DEVICE, RequestType.PROFILE_LIST, Map.of());
        MdmCommand theirs = commandQueueService.enqueue(OTHER_DEVICE, RequestType.RESTRICTIONS, Map.of());

        assertThat(commandQueueService.nextCommand(OTHER_DEVICE)).contains(theirs);
        assertThat(commandQueueService.nextCommand(DEVICE)).contains(mine);
        assertThat(commandQueueService.nextCommand("unknown-device")).isEmpty();
    }

    @Test
    @DisplayName("completing anything but the head is rejected and leaves the queue intact")
    void complete_rejectsCommandThatIsNotInFlight() {
        MdmCommand first = commandQueueService.enqueue(DEVICE, RequestType.PROFILE_LIST, Map.of());
        MdmCommand second = commandQueueService.enqueue(DEVICE, RequestType.SECURITY_INFO, Map.of());

        assertThatThrownBy(() -> commandQueueService.complete(DEVICE, second.getCommandUuid(),
                CommandResponseStatus.ACKNOWLEDGED, Map.of()))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.UNKNOWN_COMMAND);

        assertThat(queueStore.snapshot(DEVICE)).containsExactly(first.getCommandUuid(), second.getCommandUuid());
        assertThat(second.getStatus()).isEqualTo(CommandStatus.PENDING);
    }

    @Test
    @DisplayName("a NotNow answer fails the command and moves on")
    void complete_notNowFailsCommand() {
        MdmCommand first = commandQueueService.enqueue(DEVICE, RequestType.DEVICE_LOCK, Map.of());

        MdmCommand completed = commandQueueService.complete(DEVICE, first.getCommandUuid(),
                CommandResponseStatus.NOT_NOW, Map.of("Status", "NotNow"));

        assertThat(completed.getStatus()).isEqualTo(CommandStatus.FAILED);
        assertThat(completed.getResponseStatus()).isEqualTo("NotNow");
        assertThat(commandQueueService.nextCommand(DEVICE)).isEmpty();
    }

    @Test
    @DisplayName("enqueue beyond the plan's outstanding limit is rejected with Retry-After")
    void enqueue_rejectsWhenQueueIsFull() {
        when(entitlementDirectory.tierFor(anyString(), eq(DEVICE))).thenReturn(EntitlementTier.FREE);
        for (int i = 0; i < EntitlementTier.FREE.maxOutstandingCommands(); i++) {
            commandQueueService.enqueue(DEVICE, RequestType.PROFILE_LIST, Map.of());
        }

        assertThatThrownBy(() -> commandQueueService.enqueue(DEVICE, RequestType.PROFILE_LIST, Map.of()))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getCode()).isEqualTo("COMMAND_QUEUE_FULL");
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(CommandQueueService.QUEUE_FULL_RETRY_AFTER_SECONDS);
                });
        assertThat(commandTable.rows()).hasSize(EntitlementTier.FREE.maxOutstandingCommands());
    }

    @Test
    @DisplayName("enqueue for an unknown device fails with DEVICE_NOT_FOUND")
    void enqueue_unknownDevice() {
        when(deviceRecordRepository.findByDeviceId("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> commandQueueService.enqueue("ghost", RequestType.PROFILE_LIST, Map.of()))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.DEVICE_NOT_FOUND);
    }

    @Test
    @DisplayName("a pending command can be cancelled, twice without error")
    void cancel_pendingCommand() {
        MdmCommand first = commandQueueService.enqueue(DEVICE, RequestType.PROFILE_LIST, Map.of());
        MdmCommand second = commandQueueService.enqueue(DEVICE, RequestType.SECURITY_INFO, Map.of());

        MdmCommand cancelled = commandQueueService.cancel(DEVICE, first.getCommandUuid());
        MdmCommand again = commandQueueService.cancel(DEVICE, first.getCommandUuid());

        assertThat(cancelled.getStatus()).isEqualTo(CommandStatus.CANCELLED);
        assertThat(again).isSameAs(cancelled);
        assertThat(commandQueueService.nextCommand(DEVICE)).contains(second);
        verify(deviceEventService).record(eq(DEVICE), eq(DeviceEventType.COMMAND_CANCELLED),
                eq(Map.of("commandUUID", first.getCommandUuid().toString(), "requestType", "ProfileList")));
    }

    @Test
    @DisplayName("a command already handed to the device cannot be cancelled")
    void cancel_sentCommandIsRejected() {
        MdmCommand first = commandQueueService.enqueue(DEVICE, RequestType.PROFILE_LIST, Map.of());
        commandQueueService.nextCommand(DEVICE);

        assertThatThrownBy(() -> commandQueueService.cancel(DEVICE, first.getCommandUuid()))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.COMMAND_ALREADY_SENT);
    }

    @Test
    @DisplayName("cancelling another device's command looks like an unknown command")
    void cancel_otherDevicesCommand() {
        MdmCommand theirs = commandQueueService.enqueue(OTHER_DEVICE, RequestType.PROFILE_LIST, Map.of());

        assertThatThrownBy(() -> commandQueueService.cancel(DEVICE, theirs.getCommandUuid()))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.COMMAND_NOT_FOUND);
        verify(deviceEventService, never()).record(anyString(), eq(DeviceEventType.COMMAND_CANCELLED), anyMap());
    }

    @Test
    @DisplayName("an empty live queue is rebuilt from outstanding rows in order")
    void nextCommand_rehydratesFromCommandTable() {
        MdmCommand first = commandTable.add(MdmCommand.pending(DEVICE, RequestType.PROFILE_LIST, Map.of()));
        MdmCommand second = commandTable.add(MdmCommand.pending(DEVICE, RequestType.RESTRICTIONS, Map.of()));
        MdmCommand done = MdmCommand.pending(DEVICE, RequestType.SECURITY_INFO, Map.of());
        done.acknowledge(OffsetDateTime.parse("2024-12-31T00:00:00Z"), Map.of());
        commandTable.add(done);

        assertThat(commandQueueService.nextCommand(DEVICE)).contains(first);
        assertThat(queueStore.snapshot(DEVICE)).containsExactly(first.getCommandUuid(), second.getCommandUuid());
    }

    @Test
    @DisplayName("stale ids left in the live queue are skipped")
    void nextCommand_dropsStaleEntries() {
        queueStore.append(DEVICE, UUID.randomUUID());
        MdmCommand real = commandQueueService.enqueue(DEVICE, RequestType.PROFILE_LIST, Map.of());

        assertThat(commandQueueService.nextCommand(DEVICE)).contains(real);
        assertThat(queueStore.snapshot(DEVICE)).containsExactly(real.getCommandUuid());
    }

    @Test
    @DisplayName("a command whose completion rolled back stays at the head even if the live queue lost it")
    void nextCommand_keepsInFlightCommandAfterRolledBackCompletion() {
        MdmCommand first = commandQueueService.enqueue(DEVICE, RequestType.PROFILE_LIST, Map.of());
        MdmCommand second = commandQueueService.enqueue(DEVICE, RequestType.SECURITY_INFO, Map.of());
        assertThat(commandQueueService.nextCommand(DEVICE)).contains(first);
        // the live removal survived while the row stayed SENT
        queueStore.remove(DEVICE, first.getCommandUuid());

        assertThat(commandQueueService.nextCommand(DEVICE)).contains(first);
        assertThat(second.getStatus()).isEqualTo(CommandStatus.PENDING);
        assertThat(queueStore.snapshot(DEVICE)).containsExactly(first.getCommandUuid(), second.getCommandUuid());

        MdmCommand completed = commandQueueService.complete(DEVICE, first.getCommandUuid(),
                CommandResponseStatus.ACKNOWLEDGED, Map.of());
        assertThat(completed.getStatus()).isEqualTo(CommandStatus.ACKNOWLEDGED);
        assertThat(commandQueueService.nextCommand(DEVICE)).contains(second);
    }

    @Test
    @DisplayName("DeviceInformation defaults its queries when none are given")
    void enqueue_defaultsDeviceInformationQueries() {
        MdmCommand command = commandQueueService.enqueue(DEVICE, RequestType.DEVICE_INFORMATION, Map.of());

        assertThat(command.getPayload()).containsEntry("Queries", CommandPayloadFactory.DEFAULT_DEVICE_QUERIES);
        assertThat(commandQueueService.outstandingCount(DEVICE)).isEqualTo(1);
        assertThat(commandQueueService.hasPending(DEVICE)).isTrue();
        assertThat(commandQueueService.hasPending(OTHER_DEVICE)).isFalse();
    }

    private CommandQueueService newService(InMemoryCommandQueueStore store, Clock clock) {
        return new CommandQueueService(
                commandTable.repository(),
                store,
                deviceRecordRepository,
                entitlementDirectory,
                new CommandPayloadFactory(supervisionProfileRepository),
                deviceEventService,
                clock
        );
    }

    private static DeviceRecord device(String deviceId) {
        DeviceRecord device = new DeviceRecord();
        device.setDeviceId(deviceId);
        device.setUserId("user-" + deviceId.substring(deviceId.length() - 1));
        return device;
    }
}
