package com.altrii.mdm.modules.command.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.global.plist.PlistValues;
import com.altrii.mdm.modules.audit.application.DeviceEventService;
import com.altrii.mdm.modules.audit.domain.DeviceEventType;
import com.altrii.mdm.modules.command.domain.CommandStatus;
import com.altrii.mdm.modules.command.domain.MdmCommand;
import com.altrii.mdm.modules.command.domain.RequestType;
import com.altrii.mdm.modules.command.infrastructure.persistence.MdmCommandRepository;
import com.altrii.mdm.modules.device.domain.DeviceAppInventory;
import com.altrii.mdm.modules.device.domain.DeviceRecord;
import com.altrii.mdm.modules.device.domain.DeviceRestrictionSnapshot;
import com.altrii.mdm.modules.device.infrastructure.persistence.BlockedAppRepository;
import com.altrii.mdm.modules.device.infrastructure.persistence.DeviceAppInventoryRepository;
import com.altrii.mdm.modules.device.infrastructure.persistence.DeviceRecordRepository;
import com.altrii.mdm.modules.device.infrastructure.persistence.DeviceRestrictionSnapshotRepository;
import com.altrii.mdm.modules.profile.domain.SupervisionCatalog;
import com.altrii.mdm.modules.profile.infrastructure.persistence.SupervisionProfileRepository;
import com.altrii.mdm.modules.session.application.SessionRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Folds command results back into durable device state. Observations only: nothing here
 * enqueues remediation.
 */
@Component
@Transactional
public class CommandReconciler {

    private static final Logger log = LoggerFactory.getLogger(CommandReconciler.class);

    private final DeviceRecordRepository deviceRecordRepository;
    private final SupervisionProfileRepository supervisionProfileRepository;
    private final DeviceAppInventoryRepository appInventoryRepository;
    private final BlockedAppRepository blockedAppRepository;
    private final DeviceRestrictionSnapshotRepository restrictionSnapshotRepository;
    private final MdmCommandRepository commandRepository;
    private final SessionRegistry sessionRegistry;
    private final DeviceEventService deviceEventService;
    private final MdmProperties properties;
    private final Clock clock;

    public CommandReconciler(
            DeviceRecordRepository deviceRecordRepository,
            SupervisionProfileRepository supervisionProfileRepository,
            DeviceAppInventoryRepository appInventoryRepository,
            BlockedAppRepository blockedAppRepository,
            DeviceRestrictionSnapshotRepository restrictionSnapshotRepository,
            MdmCommandRepository commandRepository,
            SessionRegistry sessionRegistry,
            DeviceEventService deviceEventService,
            MdmProperties properties,
            Clock clock
    ) {
        this.deviceRecordRepository = deviceRecordRepository;
        this.supervisionProfileRepository = supervisionProfileRepository;
        this.appInventoryRepository = appInventoryRepository;
        this.blockedAppRepository = blockedAppRepository;
        this.restrictionSnapshotRepository = restrictionSnapshotRepository;
        this.commandRepository = commandRepository;
        this.sessionRegistry = sessionRegistry;
        this.deviceEventService = deviceEventService;
        this.properties = properties;
        this.clock = clock;
    }

    public void onAcknowledged(MdmCommand command, Map<String, Object> response) {
        String deviceId = command.getDeviceId();
        switch (command.getRequestType()) {
            case PROFILE_LIST -> reconcileProfileList(deviceId, PlistValues.dictionaries(response, "ProfileList"));
            case SECURITY_INFO -> reconcileSecurityInfo(deviceId, PlistValues.dictionary(response, "SecurityInfo"));
            case INSTALLED_APPLICATION_LIST -> reconcileAppInventory(deviceId,
                    PlistValues.dictionaries(response, "InstalledApplicationList"));
            case RESTRICTIONS -> reconcileRestrictions(deviceId, reportedRestrictions(response));
            default -> log.debug("No reconciliation for {} on device {}", command.getRequestType().wireName(), deviceId);
        }
    }

    public void onFailed(MdmCommand command) {
        if (command.getRequestType() != RequestType.DEVICE_LOCK) {
            return;
        }
        int threshold = properties.getCommands().getDeviceLockAlertThreshold();
        List<MdmCommand> recent = commandRepository.findByDeviceIdAndRequestTypeAndStatusInOrderByIdDesc(
                command.getDeviceId(),
                RequestType.DEVICE_LOCK,
                List.of(CommandStatus.ACKNOWLEDGED, CommandStatus.FAILED),
                PageRequest.of(0, threshold + 1)
        );
        int consecutiveFailures = 0;
        for (MdmCommand candidate : recent) {
            if (candidate.getStatus() != CommandStatus.FAILED) {
                break;
            }
            consecutiveFailures++;
        }
        // alert once when the streak reaches the threshold, not on every later failure
        if (consecutiveFailures == threshold) {
            log.warn("Device {} failed {} consecutive DeviceLock commands", command.getDeviceId(), consecutiveFailures);
            deviceEventService.record(command.getDeviceId(), DeviceEventType.DEVICE_LOCK_FAILURES, Map.of(
                    "consecutiveFailures", consecutiveFailures,
                    "lastCommandUUID", command.getCommandUuid().toString()
            ));
        }
    }

    void reconcileProfileList(String deviceId, List<Map<String, Object>> profiles) {
        log.debug("Device {} reports {} installed profiles", deviceId, profiles.size());
        Optional<String> supervisionIdentifier = profiles.stream()
                .map(profile -> PlistValues.string(profile, "PayloadIdentifier").orElse(null))
                .filter(SupervisionCatalog::isSupervisionProfile)
                .findFirst();
        if (supervisionIdentifier.isEmpty()) {
            return;
        }
        supervisionProfileRepository.findByDeviceIdAndProfileIdentifier(deviceId, supervisionIdentifier.get())
                .ifPresent(profile -> profile.markInstalled(OffsetDateTime.now(clock)));
        deviceRecordRepository.findByDeviceId(deviceId).ifPresent(device -> device.setMdmEnrolled(true));
    }

    void reconcileSecurityInfo(String deviceId, Map<String, Object> securityInfo) {
        boolean supervised = PlistValues.bool(securityInfo, "IsSupervised");
        sessionRegistry.markSupervised(deviceId, supervised);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("supervised", supervised);
        detail.put("passcodeSet", PlistValues.bool(securityInfo, "PasscodePresent"));
        PlistValues.optionalBool(securityInfo, "PasscodeCompliant")
                .ifPresent(value -> detail.put("passcodeCompliant", value));
        PlistValues.optionalBool(securityInfo, "PasscodeCompliantWithProfiles")
                .ifPresent(value -> detail.put("passcodeCompliantWithProfiles", value));
        deviceEventService.record(deviceId, DeviceEventType.SECURITY_INFO_UPDATED, detail);
    }

    void reconcileAppInventory(String deviceId, List<Map<String, Object>> apps) {
        appInventoryRepository.deleteAllForDevice(deviceId);
        Set<String> blockedBundleIds = new HashSet<>(blockedAppRepository.findAllBundleIdentifiers());
        OffsetDateTime now = OffsetDateTime.now(clock);

        Map<String, DeviceAppInventory> inventory = new LinkedHashMap<>();
        List<Map<String, Object>> prohibited = new ArrayList<>();
        for (Map<String, Object> app : apps) {
            Optional<String> bundleId = PlistValues.string(app, "Identifier")
                    .or(() -> PlistValues.string(app, "BundleIdentifier"));
            if (bundleId.isEmpty() || inventory.containsKey(bundleId.get())) {
                continue;
            }
            DeviceAppInventory entry = new DeviceAppInventory();
            entry.setDeviceId(deviceId);
            entry.setBundleIdentifier(bundleId.get());
            entry.setAppName(PlistValues.string(app, "Name").orElse(bundleId.get()));
            entry.setVersion(PlistValues.string(app, "ShortVersion")
                    .or(() -> PlistValues.string(app, "Version"))
                    .orElse(null));
            entry.setSystemApp(PlistValues.bool(app, "IsSystemApp"));
            entry.setBlocked(blockedBundleIds.contains(bundleId.get()));
            entry.setLastSeenAt(now);
            inventory.put(bundleId.get(), entry);

            if (entry.isBlocked() && !entry.isSystemApp()) {
                Map<String, Object> found = new LinkedHashMap<>();
                found.put("bundleId", entry.getBundleIdentifier());
                found.put("name", entry.getAppName());
                prohibited.add(found);
            }
        }
        appInventoryRepository.saveAll(inventory.values());

        if (!prohibited.isEmpty()) {
            log.warn("Device {} has {} prohibited apps installed", deviceId, prohibited.size());
            deviceEventService.record(deviceId, DeviceEventType.PROHIBITED_APPS_DETECTED, Map.of("apps", prohibited));
        }
    }

    void reconcileRestrictions(String deviceId, Map<String, Object> restrictions) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        DeviceRestrictionSnapshot snapshot = restrictionSnapshotRepository.findById(deviceId)
                .orElseGet(() -> new DeviceRestrictionSnapshot(deviceId));
        snapshot.setRestrictionSet(new LinkedHashMap<>(restrictions));
        snapshot.setVerifiedAt(now);
        restrictionSnapshotRepository.save(snapshot);

        int level = deviceRecordRepository.findByDeviceId(deviceId)
                .map(DeviceRecord::getSupervisionLevel)
                .orElse(0);
        List<String> issues = new ArrayList<>();
        if (level >= 2 && !isDisabled(restrictions, "allowVPNCreation")) {
            issues.add("VPN creation not blocked");
        }
        if (level >= 3) {
            if (!isDisabled(restrictions, "allowAppInstallation")) {
                issues.add("App installation not blocked");
            }
            if (!isDisabled(restrictions, "allowEraseContentAndSettings")) {
                issues.add("Factory reset not blocked");
            }
        }
        if (!issues.isEmpty()) {
            log.warn("Device {} restriction issues: {}", deviceId, issues);
            deviceEventService.record(deviceId, DeviceEventType.RESTRICTION_VIOLATIONS, Map.of("issues", issues));
        }
    }

    /**
     * Accepts the flat {@code Restrictions} dictionary as well as the
     * {@code GlobalRestrictions.restrictedBool.<key>.value} shape iOS reports.
     */
    static Map<String, Object> reportedRestrictions(Map<String, Object> response) {
        Map<String, Object> flat = PlistValues.dictionary(response, "Restrictions");
        if (!flat.isEmpty()) {
            return flat;
        }
        Map<String, Object> restrictedBool = PlistValues.dictionary(
                PlistValues.dictionary(response, "GlobalRestrictions"), "restrictedBool");
        Map<String, Object> result = new LinkedHashMap<>();
        restrictedBool.forEach((key, value) -> {
            if (value instanceof Map<?, ?> entry && entry.get("value") instanceof Boolean flag) {
                result.put(key, flag);
            }
        });
        return result;
    }

    private static boolean isDisabled(Map<String, Object> restrictions, String key) {
        return Boolean.FALSE.equals(restrictions.get(key));
    }
}
