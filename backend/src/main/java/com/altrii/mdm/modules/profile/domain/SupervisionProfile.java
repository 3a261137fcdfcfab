package com.altrii.mdm.modules.profile.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import com.altrii.mdm.global.jpa.AbstractTimestampedEntity;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Latest generated supervision profile of a device. Regenerating replaces the row contents
 * and resets the installed flag.
 */
@Entity
@Table(
        name = "supervision_profiles",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_supervision_profiles_device_identifier",
                columnNames = {"device_id", "profile_identifier"}
        )
)
public class SupervisionProfile extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "profile_uuid", nullable = false, unique = true, columnDefinition = "uuid")
    private UUID profileUuid;

    @Column(name = "device_id", nullable = false, updatable = false, length = 64)
    private String deviceId;

    @Column(name = "profile_identifier", nullable = false, updatable = false, length = 255)
    private String profileIdentifier;

    @Column(name = "display_name", nullable = false, length = 120)
    private String displayName;

    @Column(name = "security_level", nullable = false)
    private int securityLevel;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "content_filter_spec", columnDefinition = "jsonb")
    private Map<String, Object> contentFilterSpec;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "restriction_spec", columnDefinition = "jsonb")
    private Map<String, Object> restrictionSpec;

    @Column(name = "profile_data", nullable = false)
    private byte[] profileData;

    @Column(name = "signed", nullable = false)
    private boolean signed;

    @Column(name = "installed", nullable = false)
    private boolean installed;

    @Column(name = "install_date")
    private OffsetDateTime installDate;

    protected SupervisionProfile() {
    }

    public SupervisionProfile(String deviceId, String profileIdentifier) {
        this.deviceId = deviceId;
        this.profileIdentifier = profileIdentifier;
    }

    public void replaceWith(ConfigurationProfile profile, ProfileDocument document,
                            Map<String, Object> contentFilter, Map<String, Object> restrictions) {
        this.profileUuid = profile.profileUuid();
        this.displayName = profile.displayName();
        this.securityLevel = profile.securityLevel().value();
        this.contentFilterSpec = contentFilter;
        this.restrictionSpec = restrictions;
        this.profileData = document.bytes();
        this.signed = document.signed();
        this.installed = false;
        this.installDate = null;
    }

    public void markInstalled(OffsetDateTime now) {
        this.installed = true;
        this.installDate = now;
    }

    public UUID getId() {
        return id;
    }

    public UUID getProfileUuid() {
        return profileUuid;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getProfileIdentifier() {
        return profileIdentifier;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getSecurityLevel() {
        return securityLevel;
    }

    public Map<String, Object> getContentFilterSpec() {
        return contentFilterSpec;
    }

    public Map<String, Object> getRestrictionSpec() {
        return restrictionSpec;
    }

    public byte[] getProfileData() {
        return profileData;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isInstalled() {
        return installed;
    }

    public OffsetDateTime getInstallDate() {
        return installDate;
    }
}
