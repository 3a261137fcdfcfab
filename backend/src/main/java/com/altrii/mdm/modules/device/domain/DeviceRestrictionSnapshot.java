package com.altrii.mdm.modules.device.domain;

import java.time.OffsetDateTime;
import java.util.Map;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import com.altrii.mdm.global.jpa.AbstractTimestampedEntity;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "device_restrictions")
public class DeviceRestrictionSnapshot extends AbstractTimestampedEntity {

    @Id
    @Column(name = "device_id", nullable = false, updatable = false, length = 64)
    private String deviceId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "restriction_set", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> restrictionSet;

    @Column(name = "verified_at", nullable = false)
    private OffsetDateTime verifiedAt;

    protected DeviceRestrictionSnapshot() {
    }

    public DeviceRestrictionSnapshot(String deviceId) {
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public Map<String, Object> getRestrictionSet() {
        return restrictionSet;
    }

    public void setRestrictionSet(Map<String, Object> restrictionSet) {
        this.restrictionSet = restrictionSet;
    }

    public OffsetDateTime getVerifiedAt() {
        return verifiedAt;
    }

    public void setVerifiedAt(OffsetDateTime verifiedAt) {
        this.verifiedAt = verifiedAt;
    }
}
