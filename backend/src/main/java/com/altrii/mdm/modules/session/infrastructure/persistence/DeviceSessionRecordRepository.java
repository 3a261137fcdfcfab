package com.altrii.mdm.modules.session.infrastructure.persistence;

import com.altrii.mdm.modules.session.domain.DeviceSessionRecord;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DeviceSessionRecordRepository extends JpaRepository<DeviceSessionRecord, String> {
}
