package com.altrii.mdm.modules.command.infrastructure.store;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.modules.command.domain.CommandQueueStore;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "mdm.store.type", havingValue = "redis")
public class RedisCommandQueueStore implements CommandQueueStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisCommandQueueStore(StringRedisTemplate redisTemplate, MdmProperties properties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.getStore().getRedisKeyPrefix() + "commands:";
    }

    @Override
    public void append(String deviceId, UUID commandUuid) {
        redisTemplate.opsForList().rightPush(key(deviceId), commandUuid.toString());
    }

    @Override
    public Optional<UUID> peek(String deviceId) {
        String head = redisTemplate.opsForList().index(key(deviceId), 0);
        return Optional.ofNullable(head).map(UUID::fromString);
    }

    @Override
    public void remove(String deviceId, UUID commandUuid) {
        redisTemplate.opsForList().remove(key(deviceId), 1, commandUuid.toString());
    }

    @Override
    public List<UUID> snapshot(String deviceId) {
        List<String> ids = redisTemplate.opsForList().range(key(deviceId), 0, -1);
        if (ids == null) {
            return List.of();
        }
        return ids.stream().map(UUID::fromString).toList();
    }

    @Override
    public void replace(String deviceId, List<UUID> commandUuids) {
        String key = key(deviceId);
        redisTemplate.delete(key);
        if (!commandUuids.isEmpty()) {
            redisTemplate.opsForList().rightPushAll(key, commandUuids.stream().map(UUID::toString).toList());
        }
    }

    private String key(String deviceId) {
        return keyPrefix + deviceId;
    }
}
