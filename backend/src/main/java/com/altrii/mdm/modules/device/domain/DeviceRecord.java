package com.altrii.mdm.modules.device.domain;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import com.altrii.mdm.global.jpa.AbstractTimestampedEntity;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "device_profiles")
public class DeviceRecord extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "device_id", nullable = false, unique = true, length = 64)
    private String deviceId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "device_name", length = 120)
    private String deviceName;

    @Column(name = "mdm_enrolled", nullable = false)
    private boolean mdmEnrolled;

    @Column(name = "supervision_level", nullable = false)
    private int supervisionLevel;

    public UUID getId() {
        return id;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public void setDeviceName(String deviceName) {
        this.deviceName = deviceName;
    }

    public boolean isMdmEnrolled() {
        return mdmEnrolled;
    }

    public void setMdmEnrolled(boolean mdmEnrolled) {
        this.mdmEnrolled = mdmEnrolled;
    }

    public int getSupervisionLevel() {
        return supervisionLevel;
    }

    public void setSupervisionLevel(int supervisionLevel) {
        this.supervisionLevel = supervisionLevel;
    }

    public void unenroll() {
        this.mdmEnrolled = false;
        this.supervisionLevel = 0;
    }
}
