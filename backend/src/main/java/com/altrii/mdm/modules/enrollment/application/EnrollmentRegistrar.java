package com.altrii.mdm.modules.enrollment.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.altrii.mdm.global.concurrent.DeviceLockRegistry;
import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.modules.audit.application.DeviceEventService;
import com.altrii.mdm.modules.audit.domain.DeviceEventType;
import com.altrii.mdm.modules.device.infrastructure.persistence.DeviceRecordRepository;
import com.altrii.mdm.modules.enrollment.domain.EnrollmentStatus;
import com.altrii.mdm.modules.enrollment.domain.EnrollmentTicket;
import com.altrii.mdm.modules.enrollment.domain.EnrollmentTicketStore;
import com.altrii.mdm.modules.enrollment.domain.SupervisionEnrollment;
import com.altrii.mdm.modules.enrollment.domain.TicketState;
import com.altrii.mdm.modules.enrollment.infrastructure.persistence.SupervisionEnrollmentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues single-use enrollment codes and hands out the profile behind each code exactly
 * once before it expires.
 */
@Service
@Transactional
public class EnrollmentRegistrar {

    private static final Logger log = LoggerFactory.getLogger(EnrollmentRegistrar.class);

    private static final String LOCK_PREFIX = "enrollment:";

    private final EnrollmentTicketStore ticketStore;
    private final SupervisionEnrollmentRepository enrollmentRepository;
    private final DeviceRecordRepository deviceRecordRepository;
    private final DeviceEventService deviceEventService;
    private final EnrollmentCodeGenerator codeGenerator;
    private final DeviceLockRegistry lockRegistry;
    private final MdmProperties properties;
    private final Clock clock;

    public EnrollmentRegistrar(
            EnrollmentTicketStore ticketStore,
            SupervisionEnrollmentRepository enrollmentRepository,
            DeviceRecordRepository deviceRecordRepository,
            DeviceEventService deviceEventService,
            EnrollmentCodeGenerator codeGenerator,
            DeviceLockRegistry lockRegistry,
            MdmProperties properties,
            Clock clock
    ) {
        this.ticketStore = ticketStore;
        this.enrollmentRepository = enrollmentRepository;
        this.deviceRecordRepository = deviceRecordRepository;
        this.deviceEventService = deviceEventService;
        this.codeGenerator = codeGenerator;
        this.lockRegistry = lockRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    public EnrollmentTicket issueCode(byte[] profileBytes, String deviceId, String userId, UUID profileUuid) {
        Instant expiresAt = clock.instant().plus(properties.getEnrollment().getTicketTtl());
        String code = uniqueCode();
        EnrollmentTicket ticket = new EnrollmentTicket(code, profileBytes, deviceId, userId, profileUuid, expiresAt,
                TicketState.ISSUED);

        enrollmentRepository.save(new SupervisionEnrollment(code, deviceId, userId, profileUuid,
                expiresAt.atOffset(ZoneOffset.UTC)));
        ticketStore.save(ticket);
        log.info("Issued enrollment code for device {} expiring {}", deviceId, expiresAt);
        return ticket;
    }

    /**
     * Returns the ticket for a first download and moves it to DOWNLOADED. Unknown and
     * already used codes are INVALID_CODE. A code past its expiry is evicted, its row is
     * marked EXPIRED and the call fails with EXPIRED.
     */
    @Transactional(noRollbackFor = MdmException.class)
    public EnrollmentTicket resolve(String code) {
        if (ticketStore.find(code).isEmpty()) {
            throw invalidCode();
        }
        return lockRegistry.withLock(LOCK_PREFIX + code, () -> {
            EnrollmentTicket ticket = ticketStore.find(code).orElseThrow(EnrollmentRegistrar::invalidCode);
            Instant now = clock.instant();
            if (ticket.isExpiredAt(now)) {
                ticketStore.remove(code);
                enrollmentRepository.findByEnrollmentCode(code).ifPresent(SupervisionEnrollment::markExpired);
                throw new MdmException(MdmErrorCode.EXPIRED, "Enrollment code expired");
            }
            if (ticket.state() == TicketState.DOWNLOADED) {
                throw new MdmException(MdmErrorCode.INVALID_CODE, "Enrollment code already used");
            }

            EnrollmentTicket downloaded = ticket.downloaded();
            ticketStore.save(downloaded);
            enrollmentRepository.findByEnrollmentCode(code)
                    .ifPresent(enrollment -> enrollment.markDownloaded(now.atOffset(ZoneOffset.UTC)));
            deviceEventService.record(ticket.deviceId(), DeviceEventType.PROFILE_DOWNLOADED,
                    Map.of("enrollmentCode", code));
            log.info("Enrollment profile downloaded for device {}", ticket.deviceId());
            return downloaded;
        });
    }

    /**
     * Called once the device has installed the downloaded profile.
     */
    public SupervisionEnrollment completeEnrollment(String deviceId, String userId) {
        SupervisionEnrollment enrollment = enrollmentRepository
                .findFirstByDeviceIdAndUserIdAndStatusOrderByCreatedAtDesc(deviceId, userId, EnrollmentStatus.DOWNLOADED)
                .orElseThrow(() -> new MdmException(MdmErrorCode.ENROLLMENT_NOT_DOWNLOADED,
                        "No downloaded enrollment for device " + deviceId));
        enrollment.markEnrolled(OffsetDateTime.now(clock));
        deviceRecordRepository.findByDeviceId(deviceId).ifPresent(device -> device.setMdmEnrolled(true));
        deviceEventService.record(deviceId, DeviceEventType.ENROLLED,
                Map.of("enrollmentCode", enrollment.getEnrollmentCode()));
        return enrollment;
    }

    public int sweepExpired() {
        Instant now = clock.instant();
        int evicted = ticketStore.removeExpired(now);
        List<SupervisionEnrollment> stale = enrollmentRepository.findByStatusAndExpiresAtBefore(
                EnrollmentStatus.ISSUED, now.atOffset(ZoneOffset.UTC));
        stale.forEach(SupervisionEnrollment::markExpired);
        return Math.max(evicted, stale.size());
    }

    private static MdmException invalidCode() {
        return new MdmException(MdmErrorCode.INVALID_CODE, "Invalid enrollment code");
    }

    private String uniqueCode() {
        String code = codeGenerator.nextCode();
        while (ticketStore.find(code).isPresent()) {
            code = codeGenerator.nextCode();
        }
        return code;
    }
}
