package com.altrii.mdm.support;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.altrii.mdm.modules.command.domain.CommandStatus;
import com.altrii.mdm.modules.command.domain.MdmCommand;
import com.altrii.mdm.modules.command.domain.RequestType;
import com.altrii.mdm.modules.command.infrastructure.persistence.MdmCommandRepository;

import org.springframework.data.domain.Pageable;

/**
 * List-backed stand-in for the command table. Insertion order plays the role of the
 * identity column.
 */
public final class CommandTable {

    private final List<MdmCommand> rows = new ArrayList<>();
    private final MdmCommandRepository repository = mock(MdmCommandRepository.class);

    public CommandTable() {
        lenient().when(repository.save(any(MdmCommand.class))).thenAnswer(invocation -> {
            MdmCommand command = invocation.getArgument(0);
            if (!rows.contains(command)) {
                rows.add(command);
            }
            return command;
        });
        lenient().when(repository.findByCommandUuid(any(UUID.class))).thenAnswer(invocation -> {
            UUID uuid = invocation.getArgument(0);
            return rows.stream().filter(command -> command.getCommandUuid().equals(uuid)).findFirst();
        });
        lenient().when(repository.findByDeviceIdAndStatusInOrderByIdAsc(anyString(), anyCollection()))
                .thenAnswer(invocation -> matching(invocation.getArgument(0), invocation.getArgument(1)));
        lenient().when(repository.countByDeviceIdAndStatusIn(anyString(), anyCollection()))
                .thenAnswer(invocation -> (long) matching(invocation.getArgument(0), invocation.getArgument(1)).size());
        lenient().when(repository.findByDeviceIdAndRequestTypeAndStatusInOrderByIdDesc(
                        anyString(), any(RequestType.class), anyCollection(), any(Pageable.class)))
                .thenAnswer(invocation -> {
                    String deviceId = invocation.getArgument(0);
                    RequestType requestType = invocation.getArgument(1);
                    Collection<CommandStatus> statuses = invocation.getArgument(2);
                    Pageable pageable = invocation.getArgument(3);
                    List<MdmCommand> newestFirst = new ArrayList<>(matching(deviceId, statuses).stream()
                            .filter(command -> command.getRequestType() == requestType)
                            .toList());
                    Collections.reverse(newestFirst);
                    return newestFirst.stream().limit(pageable.getPageSize()).toList();
                });
    }

    public MdmCommandRepository repository() {
        return repository;
    }

    public List<MdmCommand> rows() {
        return rows;
    }

    public MdmCommand add(MdmCommand command) {
        rows.add(command);
        return command;
    }

    private List<MdmCommand> matching(String deviceId, Collection<CommandStatus> statuses) {
        return rows.stream()
                .filter(command -> command.getDeviceId().equals(deviceId))
                .filter(command -> statuses.contains(command.getStatus()))
                .toList();
    }
}
