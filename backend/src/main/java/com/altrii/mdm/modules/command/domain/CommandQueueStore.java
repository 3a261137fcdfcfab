package com.altrii.mdm.modules.command.domain;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CommandQueueStore {

    void append(String deviceId, UUID commandUuid);

    Optional<UUID> peek(String deviceId);

    void remove(String deviceId, UUID commandUuid);

    List<UUID> snapshot(String deviceId);

    void replace(String deviceId, List<UUID> commandUuids);
}
