package com.altrii.mdm.modules.command.infrastructure.store;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;

import com.altrii.mdm.modules.command.domain.CommandQueueStore;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "mdm.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCommandQueueStore implements CommandQueueStore {

    private final ConcurrentMap<String, Deque<UUID>> queues = new ConcurrentHashMap<>();

    @Override
    public void append(String deviceId, UUID commandUuid) {
        queues.computeIfAbsent(deviceId, id -> new ConcurrentLinkedDeque<>()).addLast(commandUuid);
    }

    @Override
    public Optional<UUID> peek(String deviceId) {
        Deque<UUID> queue = queues.get(deviceId);
        return queue == null ? Optional.empty() : Optional.ofNullable(queue.peekFirst());
    }

    @Override
    public void remove(String deviceId, UUID commandUuid) {
        Deque<UUID> queue = queues.get(deviceId);
        if (queue == null) {
            return;
        }
        queue.remove(commandUuid);
        if (queue.isEmpty()) {
            queues.remove(deviceId, queue);
        }
    }

    @Override
    public List<UUID> snapshot(String deviceId) {
        Deque<UUID> queue = queues.get(deviceId);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    @Override
    public void replace(String deviceId, List<UUID> commandUuids) {
        if (commandUuids.isEmpty()) {
            queues.remove(deviceId);
            return;
        }
        queues.put(deviceId, new ConcurrentLinkedDeque<>(new ArrayList<>(commandUuids)));
    }
}
