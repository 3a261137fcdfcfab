package com.altrii.mdm.modules.supervision.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.altrii.mdm.global.concurrent.DeviceSerialExecutor;
import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.modules.audit.application.DeviceEventService;
import com.altrii.mdm.modules.audit.domain.DeviceEventType;
import com.altrii.mdm.modules.command.application.CommandQueueService;
import com.altrii.mdm.modules.command.domain.MdmCommand;
import com.altrii.mdm.modules.command.domain.RequestType;
import com.altrii.mdm.modules.device.domain.DeviceRecord;
import com.altrii.mdm.modules.device.infrastructure.persistence.DeviceRecordRepository;
import com.altrii.mdm.modules.enrollment.application.EnrollmentRegistrar;
import com.altrii.mdm.modules.enrollment.domain.EnrollmentTicket;
import com.altrii.mdm.modules.entitlement.application.EntitlementDirectory;
import com.altrii.mdm.modules.entitlement.domain.EntitlementTier;
import com.altrii.mdm.modules.profile.application.CategoryDomainCatalog;
import com.altrii.mdm.modules.profile.application.ProfileSigner;
import com.altrii.mdm.modules.profile.application.SupervisionProfileBuilder;
import com.altrii.mdm.modules.profile.domain.BlockingPolicy;
import com.altrii.mdm.modules.profile.domain.ConfigurationProfile;
import com.altrii.mdm.modules.profile.domain.ProfileBuildRequest;
import com.altrii.mdm.modules.profile.domain.ProfileDocument;
import com.altrii.mdm.modules.profile.domain.SecurityLevel;
import com.altrii.mdm.modules.profile.domain.SupervisionCatalog;
import com.altrii.mdm.modules.profile.domain.SupervisionProfile;
import com.altrii.mdm.modules.profile.infrastructure.persistence.SupervisionProfileRepository;
import com.altrii.mdm.modules.push.domain.WakeRequested;
import com.altrii.mdm.modules.session.application.SessionRegistry;
import com.altrii.mdm.modules.session.domain.DeviceSession;
import com.altrii.mdm.modules.supervision.presentation.dto.BlockingSettingsRequest;
import com.altrii.mdm.modules.supervision.presentation.dto.CommandReceiptResponse;
import com.altrii.mdm.modules.supervision.presentation.dto.DeviceStatusResponse;
import com.altrii.mdm.modules.supervision.presentation.dto.GenerateProfileRequest;
import com.altrii.mdm.modules.supervision.presentation.dto.GenerateProfileResponse;
import com.altrii.mdm.modules.supervision.presentation.dto.ProfileResponse;
import com.altrii.mdm.modules.supervision.presentation.dto.SendCommandRequest;
import com.altrii.mdm.modules.supervision.presentation.dto.VerificationResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Operator-facing use cases. Queue mutations run through {@link DeviceSerialExecutor} so they
 * interleave safely with the device's own check-ins and command responses.
 */
@Service
public class SupervisionService {

    private static final Logger log = LoggerFactory.getLogger(SupervisionService.class);

    static final List<RequestType> VERIFICATION_COMMANDS = List.of(
            RequestType.PROFILE_LIST,
            RequestType.SECURITY_INFO,
            RequestType.RESTRICTIONS,
            RequestType.INSTALLED_APPLICATION_LIST
    );

    private final DeviceRecordRepository deviceRecordRepository;
    private final SupervisionProfileRepository profileRepository;
    private final EntitlementDirectory entitlementDirectory;
    private final CategoryDomainCatalog categoryDomainCatalog;
    private final SupervisionProfileBuilder profileBuilder;
    private final ProfileSigner profileSigner;
    private final EnrollmentRegistrar enrollmentRegistrar;
    private final CommandQueueService commandQueueService;
    private final SessionRegistry sessionRegistry;
    private final DeviceSerialExecutor serialExecutor;
    private final DeviceEventService deviceEventService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public SupervisionService(
            DeviceRecordRepository deviceRecordRepository,
            SupervisionProfileRepository profileRepository,
            EntitlementDirectory entitlementDirectory,
            CategoryDomainCatalog categoryDomainCatalog,
            SupervisionProfileBuilder profileBuilder,
            ProfileSigner profileSigner,
            EnrollmentRegistrar enrollmentRegistrar,
            CommandQueueService commandQueueService,
            SessionRegistry sessionRegistry,
            DeviceSerialExecutor serialExecutor,
            DeviceEventService deviceEventService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.deviceRecordRepository = deviceRecordRepository;
        this.profileRepository = profileRepository;
        this.entitlementDirectory = entitlementDirectory;
        this.categoryDomainCatalog = categoryDomainCatalog;
        this.profileBuilder = profileBuilder;
        this.profileSigner = profileSigner;
        this.enrollmentRegistrar = enrollmentRegistrar;
        this.commandQueueService = commandQueueService;
        this.sessionRegistry = sessionRegistry;
        this.serialExecutor = serialExecutor;
        this.deviceEventService = deviceEventService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public GenerateProfileResponse generateProfile(GenerateProfileRequest request) {
        SecurityLevel level = SecurityLevel.of(request.securityLevel());
        DeviceRecord device = loadDevice(request.deviceId());

        EntitlementTier tier = entitlementDirectory.tierFor(request.userId(), request.deviceId());
        if (!tier.permitsSecurityLevel(level.value())) {
            throw new MdmException(MdmErrorCode.SECURITY_LEVEL_NOT_ENTITLED,
                    "Plan " + tier + " allows security level up to " + tier.maxSecurityLevel());
        }

        BlockingSettingsRequest settings = request.settings();
        BlockingPolicy policy = settings == null ? BlockingPolicy.defaults() : settings.toPolicy();
        Set<String> categoryDomains = categoryDomainCatalog.domainsFor(policy.blockedCategories());
        boolean webOnly = !Boolean.FALSE.equals(request.webOnly());

        ConfigurationProfile profile = profileBuilder.build(new ProfileBuildRequest(
                request.deviceId(), UUID.randomUUID(), level, policy, webOnly, categoryDomains));
        ProfileDocument document = profileSigner.sign(profile);

        SupervisionProfile stored = profileRepository
                .findByDeviceIdAndProfileIdentifier(request.deviceId(), profile.identifier())
                .orElseGet(() -> new SupervisionProfile(request.deviceId(), profile.identifier()));
        stored.replaceWith(profile, document,
                profile.payload(SupervisionProfileBuilder.CONTENT_FILTER_PAYLOAD).orElse(Map.of()),
                profile.payload(SupervisionProfileBuilder.RESTRICTIONS_PAYLOAD).orElse(Map.of()));
        profileRepository.save(stored);
        device.setSupervisionLevel(level.value());

        EnrollmentTicket ticket = enrollmentRegistrar.issueCode(document.bytes(), request.deviceId(),
                request.userId(), profile.profileUuid());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("profileUUID", profile.profileUuid().toString());
        detail.put("securityLevel", level.value());
        detail.put("signed", document.signed());
        deviceEventService.record(request.deviceId(), DeviceEventType.PROFILE_GENERATED, detail);
        log.info("Generated level {} supervision profile {} for device {}", level.value(),
                profile.profileUuid(), request.deviceId());

        return new GenerateProfileResponse(
                ticket.code(),
                profile.profileUuid(),
                "/mdm/enroll/" + ticket.code(),
                ticket.expiresAt().atOffset(ZoneOffset.UTC),
                document.signed());
    }

    @Transactional(readOnly = true)
    public ProfileResponse getProfile(UUID profileId) {
        SupervisionProfile profile = profileRepository.findByProfileUuid(profileId)
                .orElseThrow(() -> new MdmException(MdmErrorCode.PROFILE_NOT_FOUND, "Profile not found: " + profileId));
        return new ProfileResponse(
                profile.getProfileUuid(),
                profile.getDeviceId(),
                profile.getProfileIdentifier(),
                profile.getDisplayName(),
                profile.getSecurityLevel(),
                profile.isSigned(),
                profile.isInstalled(),
                profile.getInstallDate(),
                profile.getUpdatedAt(),
                profile.getContentFilterSpec(),
                profile.getRestrictionSpec());
    }

    public CommandReceiptResponse sendCommand(String deviceId, SendCommandRequest request) {
        RequestType requestType = RequestType.fromWireName(request.commandType())
                .orElseThrow(() -> new MdmException(MdmErrorCode.UNSUPPORTED_COMMAND_TYPE,
                        "Unsupported command type: " + request.commandType()));
        Map<String, Object> parameters = request.parameters() == null ? Map.of() : request.parameters();

        MdmCommand command = serialExecutor.execute(deviceId, () -> {
            MdmCommand queued = commandQueueService.enqueue(deviceId, requestType, parameters);
            requestWake(deviceId, "command_enqueued");
            return queued;
        });
        return new CommandReceiptResponse(command.getCommandUuid(), requestType.wireName(), command.getStatus().name());
    }

    public CommandReceiptResponse cancelCommand(String deviceId, UUID commandUuid) {
        MdmCommand command = serialExecutor.execute(deviceId, () -> commandQueueService.cancel(deviceId, commandUuid));
        return new CommandReceiptResponse(command.getCommandUuid(), command.getRequestType().wireName(),
                command.getStatus().name());
    }

    /**
     * Queues the four read-back commands in one transaction and wakes the device once.
     */
    public VerificationResponse verifyDevice(String deviceId) {
        return serialExecutor.execute(deviceId, () -> {
            List<UUID> queued = new ArrayList<>();
            for (RequestType requestType : VERIFICATION_COMMANDS) {
                queued.add(commandQueueService.enqueue(deviceId, requestType, Map.of()).getCommandUuid());
            }
            boolean woken = requestWake(deviceId, "verification");
            return new VerificationResponse(true, queued.size(), List.copyOf(queued), woken);
        });
    }

    @Transactional(readOnly = true)
    public DeviceStatusResponse getDeviceStatus(String deviceId) {
        loadDevice(deviceId);
        Optional<DeviceSession> session = sessionRegistry.find(deviceId);
        Optional<SupervisionProfile> installed = profileRepository
                .findByDeviceIdAndProfileIdentifier(deviceId, SupervisionCatalog.profileIdentifier(deviceId))
                .filter(SupervisionProfile::isInstalled);

        OffsetDateTime lastCheckIn = session
                .map(DeviceSession::lastCheckIn)
                .map(instant -> instant.atOffset(ZoneOffset.UTC))
                .orElse(null);
        DeviceStatusResponse.DeviceInfo deviceInfo = session
                .map(s -> new DeviceStatusResponse.DeviceInfo(s.model(), s.osVersion(), s.serialNumber()))
                .orElse(null);

        return new DeviceStatusResponse(
                deviceId,
                session.isPresent(),
                lastCheckIn,
                session.map(DeviceSession::supervised).orElse(false),
                commandQueueService.outstandingCount(deviceId),
                installed.isPresent(),
                installed.map(SupervisionProfile::getSecurityLevel).orElse(0),
                deviceInfo);
    }

    private boolean requestWake(String deviceId, String reason) {
        Optional<DeviceSession> session = sessionRegistry.find(deviceId).filter(DeviceSession::canBeWoken);
        if (session.isEmpty()) {
            log.debug("Device {} has no push credentials yet; command waits for next check-in", deviceId);
            return false;
        }
        DeviceSession current = session.get();
        eventPublisher.publishEvent(new WakeRequested(deviceId, current.pushToken(), current.pushMagic(), reason));
        return true;
    }

    private DeviceRecord loadDevice(String deviceId) {
        return deviceRecordRepository.findByDeviceId(deviceId)
                .orElseThrow(() -> new MdmException(MdmErrorCode.DEVICE_NOT_FOUND, "Device not found: " + deviceId));
    }
}
