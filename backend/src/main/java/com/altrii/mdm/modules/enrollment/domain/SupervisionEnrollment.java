package com.altrii.mdm.modules.enrollment.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import com.altrii.mdm.global.jpa.AbstractTimestampedEntity;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "supervision_enrollments")
public class SupervisionEnrollment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "enrollment_code", nullable = false, unique = true, updatable = false, length = 32)
    private String enrollmentCode;

    @Column(name = "device_id", nullable = false, updatable = false, length = 64)
    private String deviceId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "profile_uuid", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID profileUuid;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private EnrollmentStatus status;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "downloaded_at")
    private OffsetDateTime downloadedAt;

    @Column(name = "enrolled_at")
    private OffsetDateTime enrolledAt;

    protected SupervisionEnrollment() {
    }

    public SupervisionEnrollment(String enrollmentCode, String deviceId, String userId, UUID profileUuid,
                                 OffsetDateTime expiresAt) {
        this.enrollmentCode = enrollmentCode;
        this.deviceId = deviceId;
        this.userId = userId;
        this.profileUuid = profileUuid;
        this.expiresAt = expiresAt;
        this.status = EnrollmentStatus.ISSUED;
    }

    public void markDownloaded(OffsetDateTime now) {
        this.status = EnrollmentStatus.DOWNLOADED;
        this.downloadedAt = now;
    }

    public void markEnrolled(OffsetDateTime now) {
        this.status = EnrollmentStatus.ENROLLED;
        this.enrolledAt = now;
    }

    public void markExpired() {
        this.status = EnrollmentStatus.EXPIRED;
    }

    public UUID getId() {
        return id;
    }

    public String getEnrollmentCode() {
        return enrollmentCode;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getUserId() {
        return userId;
    }

    public UUID getProfileUuid() {
        return profileUuid;
    }

    public EnrollmentStatus getStatus() {
        return status;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getDownloadedAt() {
        return downloadedAt;
    }

    public OffsetDateTime getEnrolledAt() {
        return enrolledAt;
    }
}
