package com.altrii.mdm.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.altrii.mdm.modules.audit.domain.DeviceEvent;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DeviceEventRepository extends JpaRepository<DeviceEvent, UUID> {

    List<DeviceEvent> findTop20ByDeviceIdOrderByCreatedAtDesc(String deviceId);
}
