package com.altrii.mdm.modules.session.infrastructure.store;

import java.util.Optional;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.modules.session.domain.DeviceSession;
import com.altrii.mdm.modules.session.domain.SessionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "mdm.store.type", havingValue = "redis")
public class RedisSessionStore implements SessionStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String key;

    public RedisSessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, MdmProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.key = properties.getStore().getRedisKeyPrefix() + "sessions";
    }

    @Override
    public Optional<DeviceSession> find(String deviceId) {
        Object json = redisTemplate.opsForHash().get(key, deviceId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.toString(), DeviceSession.class));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt session entry for device " + deviceId, ex);
        }
    }

    @Override
    public void save(DeviceSession session) {
        try {
            redisTemplate.opsForHash().put(key, session.deviceId(), objectMapper.writeValueAsString(session));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize session for device " + session.deviceId(), ex);
        }
    }

    @Override
    public void remove(String deviceId) {
        redisTemplate.opsForHash().delete(key, deviceId);
    }

    @Override
    public long count() {
        Long size = redisTemplate.opsForHash().size(key);
        return size != null ? size : 0L;
    }
}
