package com.altrii.mdm.modules.device.infrastructure.persistence;

import java.util.List;

import com.altrii.mdm.modules.device.domain.DeviceAppInventory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeviceAppInventoryRepository extends JpaRepository<DeviceAppInventory, Long> {

    List<DeviceAppInventory> findByDeviceIdOrderByBundleIdentifierAsc(String deviceId);

    @Modifying
    @Query("delete from DeviceAppInventory i where i.deviceId = :deviceId")
    int deleteAllForDevice(@Param("deviceId") String deviceId);
}
