package com.altrii.mdm.modules.enrollment.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.altrii.mdm.modules.enrollment.domain.EnrollmentStatus;
import com.altrii.mdm.modules.enrollment.domain.SupervisionEnrollment;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SupervisionEnrollmentRepository extends JpaRepository<SupervisionEnrollment, UUID> {

    Optional<SupervisionEnrollment> findByEnrollmentCode(String enrollmentCode);

    Optional<SupervisionEnrollment> findFirstByDeviceIdAndUserIdAndStatusOrderByCreatedAtDesc(
            String deviceId,
            String userId,
            EnrollmentStatus status
    );

    List<SupervisionEnrollment> findByStatusAndExpiresAtBefore(EnrollmentStatus status, OffsetDateTime cutoff);
}
