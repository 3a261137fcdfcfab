package com.altrii.mdm.modules.device.infrastructure.persistence;

import com.altrii.mdm.modules.device.domain.DeviceRestrictionSnapshot;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DeviceRestrictionSnapshotRepository extends JpaRepository<DeviceRestrictionSnapshot, String> {
}
