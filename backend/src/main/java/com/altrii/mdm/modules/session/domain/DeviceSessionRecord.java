package com.altrii.mdm.modules.session.domain;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import com.altrii.mdm.global.jpa.AbstractTimestampedEntity;

@Entity
@Table(name = "mdm_device_sessions")
public class DeviceSessionRecord extends AbstractTimestampedEntity {

    @Id
    @Column(name = "device_id", nullable = false, updatable = false, length = 64)
    private String deviceId;

    @Column(name = "udid", length = 64)
    private String udid;

    @Column(name = "push_token")
    private byte[] pushToken;

    @Column(name = "push_magic", length = 128)
    private String pushMagic;

    @Column(name = "unlock_token")
    private byte[] unlockToken;

    @Column(name = "os_version", length = 32)
    private String osVersion;

    @Column(name = "build_version", length = 32)
    private String buildVersion;

    @Column(name = "model", length = 64)
    private String model;

    @Column(name = "serial_number", length = 64)
    private String serialNumber;

    @Column(name = "supervised", nullable = false)
    private boolean supervised;

    @Column(name = "last_check_in", nullable = false)
    private OffsetDateTime lastCheckIn;

    protected DeviceSessionRecord() {
    }

    public DeviceSessionRecord(String deviceId) {
        this.deviceId = deviceId;
    }

    public void apply(DeviceSession session) {
        this.udid = session.udid();
        this.pushToken = session.pushToken();
        this.pushMagic = session.pushMagic();
        this.unlockToken = session.unlockToken();
        this.osVersion = session.osVersion();
        this.buildVersion = session.buildVersion();
        this.model = session.model();
        this.serialNumber = session.serialNumber();
        this.supervised = session.supervised();
        this.lastCheckIn = session.lastCheckIn() != null
                ? session.lastCheckIn().atOffset(ZoneOffset.UTC)
                : null;
    }

    public DeviceSession toSession() {
        return new DeviceSession(
                deviceId,
                udid,
                pushToken,
                pushMagic,
                unlockToken,
                osVersion,
                buildVersion,
                model,
                serialNumber,
                supervised,
                lastCheckIn != null ? lastCheckIn.toInstant() : null
        );
    }

    public String getDeviceId() {
        return deviceId;
    }

    public boolean isSupervised() {
        return supervised;
    }

    public void setSupervised(boolean supervised) {
        this.supervised = supervised;
    }

    public OffsetDateTime getLastCheckIn() {
        return lastCheckIn;
    }
}
