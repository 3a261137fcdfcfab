package com.altrii.mdm.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.altrii.mdm.modules.audit.domain.DeviceEvent;
import com.altrii.mdm.modules.audit.domain.DeviceEventType;
import com.altrii.mdm.modules.audit.infrastructure.DeviceEventRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DeviceEventService {

    private static final Logger log = LoggerFactory.getLogger(DeviceEventService.class);

    private final DeviceEventRepository deviceEventRepository;
    private final Clock clock;

    public DeviceEventService(DeviceEventRepository deviceEventRepository, Clock clock) {
        this.deviceEventRepository = deviceEventRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(DeviceEventCommand command) {
        Objects.requireNonNull(command.deviceId(), "deviceId is required");
        Objects.requireNonNull(command.eventType(), "eventType is required");

        DeviceEvent event = new DeviceEvent();
        event.setDeviceId(command.deviceId());
        event.setEventType(command.eventType().value());
        if (command.detail() != null && !command.detail().isEmpty()) {
            event.setEventData(new LinkedHashMap<>(command.detail()));
        }
        event.setCreatedAt(OffsetDateTime.now(clock));
        deviceEventRepository.save(event);
        log.debug("Recorded {} for device {}", event.getEventType(), command.deviceId());
    }

    public void record(String deviceId, DeviceEventType eventType, Map<String, Object> detail) {
        record(new DeviceEventCommand(deviceId, eventType, detail));
    }

    public record DeviceEventCommand(
            String deviceId,
            DeviceEventType eventType,
            Map<String, Object> detail
    ) {
    }
}
