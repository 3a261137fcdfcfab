package com.altrii.mdm.modules.enrollment.infrastructure.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.modules.enrollment.domain.EnrollmentTicket;
import com.altrii.mdm.modules.enrollment.domain.EnrollmentTicketStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "mdm.store.type", havingValue = "redis")
public class RedisEnrollmentTicketStore implements EnrollmentTicketStore {

    static final Duration EXPIRED_GRACE = Duration.ofDays(1);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;

    public RedisEnrollmentTicketStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                      MdmProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = properties.getStore().getRedisKeyPrefix() + "enrollment:";
    }

    @Override
    public void save(EnrollmentTicket ticket) {
        Duration ttl = Duration.between(clock.instant(), ticket.expiresAt()).plus(EXPIRED_GRACE);
        if (ttl.isNegative() || ttl.isZero()) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(keyPrefix + ticket.code(), objectMapper.writeValueAsString(ticket), ttl);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize enrollment ticket", ex);
        }
    }

    @Override
    public Optional<EnrollmentTicket> find(String code) {
        String json = redisTemplate.opsForValue().get(keyPrefix + code);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, EnrollmentTicket.class));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt enrollment ticket " + code, ex);
        }
    }

    @Override
    public void remove(String code) {
        redisTemplate.delete(keyPrefix + code);
    }

    @Override
    public int removeExpired(Instant now) {
        // key TTLs do the eviction
        return 0;
    }
}
