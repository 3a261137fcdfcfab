package com.altrii.mdm.modules.device.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.altrii.mdm.modules.device.domain.DeviceRecord;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DeviceRecordRepository extends JpaRepository<DeviceRecord, UUID> {

    Optional<DeviceRecord> findByDeviceId(String deviceId);

    boolean existsByDeviceId(String deviceId);
}
