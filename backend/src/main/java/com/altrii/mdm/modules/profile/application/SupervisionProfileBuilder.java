package com.altrii.mdm.modules.profile.application;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.modules.profile.domain.BlockingPolicy;
import com.altrii.mdm.modules.profile.domain.ConfigurationProfile;
import com.altrii.mdm.modules.profile.domain.ProfileBuildRequest;
import com.altrii.mdm.modules.profile.domain.SecurityLevel;
import com.altrii.mdm.modules.profile.domain.SupervisionCatalog;

import org.springframework.stereotype.Component;

/**
 * Composes the supervision profile dictionary: MDM enrollment, web content filter, and for
 * level 2 and above the restrictions and passcode payloads. Pure; the same request always
 * yields the same document.
 */
@Component
public class SupervisionProfileBuilder {

    public static final String MDM_PAYLOAD = "com.apple.mdm";
    public static final String CONTENT_FILTER_PAYLOAD = "com.apple.webcontent-filter";
    public static final String RESTRICTIONS_PAYLOAD = "com.apple.applicationaccess";
    public static final String SECURITY_PAYLOAD = "com.apple.security";

    private static final int ACCESS_RIGHTS_ALL = 8191;
    private static final int CHECK_IN_FREQUENCY_MINUTES = 15;
    private static final List<String> SERVER_CAPABILITIES = List.of(
            "com.apple.mdm.per-app-vpn",
            "com.apple.mdm.device-lock",
            "com.apple.mdm.restriction-queries"
    );

    private final MdmProperties properties;

    public SupervisionProfileBuilder(MdmProperties properties) {
        this.properties = properties;
    }

    public ConfigurationProfile build(ProfileBuildRequest request) {
        String deviceId = request.deviceId();
        SecurityLevel level = request.securityLevel();
        String identifier = SupervisionCatalog.profileIdentifier(deviceId);

        List<Map<String, Object>> content = new ArrayList<>();
        content.add(mdmPayload(request));
        content.add(contentFilterPayload(request));
        if (level.atLeast(SecurityLevel.RESTRICTED)) {
            content.add(restrictionsPayload(request));
            content.add(securityPayload(request));
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("PayloadType", "Configuration");
        document.put("PayloadVersion", 1);
        document.put("PayloadIdentifier", identifier);
        document.put("PayloadUUID", request.profileUuid().toString());
        document.put("PayloadDisplayName", SupervisionCatalog.DISPLAY_NAME);
        document.put("PayloadDescription", "Device supervision for enhanced digital wellness protection");
        document.put("PayloadOrganization", SupervisionCatalog.ORGANIZATION);
        document.put("PayloadRemovalDisallowed", level.atLeast(SecurityLevel.MAXIMUM));
        document.put(ConfigurationProfile.PAYLOAD_CONTENT, content);

        return new ConfigurationProfile(identifier, request.profileUuid(), SupervisionCatalog.DISPLAY_NAME, level, document);
    }

    /**
     * Category and custom domains, minus everything that must stay reachable.
     */
    public List<String> compileDenyList(Set<String> categoryDomains, BlockingPolicy policy) {
        Set<String> denied = new LinkedHashSet<>();
        categoryDomains.forEach(domain -> addNormalized(denied, domain));
        policy.customBlockedDomains().forEach(domain -> addNormalized(denied, domain));
        denied.removeIf(SupervisionProfileBuilder::isAlwaysAllowed);
        return List.copyOf(denied);
    }

    private Map<String, Object> mdmPayload(ProfileBuildRequest request) {
        String deviceId = request.deviceId();
        String serverUrl = trimTrailingSlash(properties.getServerUrl());
        Map<String, Object> payload = basePayload(MDM_PAYLOAD, "com.altriirecovery.mdm." + deviceId,
                "Altrii Recovery MDM", request.profileUuid());
        payload.put("ServerURL", serverUrl + "/mdm/server/" + deviceId);
        payload.put("CheckInURL", serverUrl + "/mdm/checkin/" + deviceId);
        payload.put("Topic", properties.getTopic());
        payload.put("ServerCapabilities", SERVER_CAPABILITIES);
        payload.put("AccessRights", ACCESS_RIGHTS_ALL);
        payload.put("CheckInFrequency", CHECK_IN_FREQUENCY_MINUTES);
        payload.put("UseDevelopmentAPNS", !properties.isProduction());
        return payload;
    }

    private Map<String, Object> contentFilterPayload(ProfileBuildRequest request) {
        BlockingPolicy policy = request.policy();
        Map<String, Object> payload = basePayload(CONTENT_FILTER_PAYLOAD,
                "com.altriirecovery.contentfilter." + request.deviceId(), "Altrii Recovery Content Filter",
                request.profileUuid());
        payload.put("FilterType", "BuiltIn");
        payload.put("AutoFilterEnabled", true);
        payload.put("FilterBrowsers", true);
        payload.put("FilterSockets", true);
        payload.put("BlacklistedURLs", compileDenyList(request.categoryDomains(), policy));

        Set<String> allowed = new LinkedHashSet<>(SupervisionCatalog.OPERATOR_DOMAINS);
        policy.customAllowedDomains().forEach(domain -> addNormalized(allowed, domain));
        payload.put("WhitelistedURLs", List.copyOf(allowed));

        if (request.webOnly()) {
            payload.put("FilterDataProviderBundleIdentifier", "com.apple.Safari");
            payload.put("FilterPackets", true);
            payload.put("FilterGrade", "firewall");
        }
        payload.put("PermittedURLs", SupervisionCatalog.ALWAYS_ALLOWED);
        return payload;
    }

    private Map<String, Object> restrictionsPayload(ProfileBuildRequest request) {
        BlockingPolicy policy = request.policy();
        Map<String, Object> payload = basePayload(RESTRICTIONS_PAYLOAD,
                "com.altriirecovery.restrictions." + request.deviceId(), "Altrii Recovery Restrictions",
                request.profileUuid());
        List<String> blockedApps = new ArrayList<>(SupervisionCatalog.CIRCUMVENTION_APPS);

        if (request.securityLevel() == SecurityLevel.RESTRICTED) {
            payload.put("allowAppInstallation", true);
            payload.put("allowUIAppInstallation", true);
            payload.put("allowAppRemoval", false);
            payload.put("allowInAppPurchases", false);
            payload.put("allowVPNCreation", false);
        } else {
            payload.put("allowAppInstallation", false);
            payload.put("allowUIAppInstallation", false);
            payload.put("allowAppClips", false);
            payload.put("allowAutomaticAppDownloads", false);
            payload.put("allowInAppPurchases", false);
            payload.put("allowAppRemoval", false);
            payload.put("allowEraseContentAndSettings", false);
            payload.put("allowUIConfigurationProfileInstallation", false);
            payload.put("allowVPNCreation", false);
            payload.put("allowPasscodeModification", false);
            payload.put("safariAllowJavaScript", policy.allowJavaScript());
            payload.put("safariAllowPopups", false);
            payload.put("safariAllowAutoFill", false);
            payload.put("safariForceFraudWarning", true);
            blockedApps.addAll(SupervisionCatalog.THIRD_PARTY_BROWSERS);
        }
        policy.additionalBlockedApps().stream()
                .filter(app -> app != null && !app.isBlank() && !blockedApps.contains(app))
                .forEach(blockedApps::add);
        payload.put("blacklistedAppBundleIDs", List.copyOf(blockedApps));
        return payload;
    }

    private Map<String, Object> securityPayload(ProfileBuildRequest request) {
        Map<String, Object> payload = basePayload(SECURITY_PAYLOAD,
                "com.altriirecovery.security." + request.deviceId(), "Altrii Recovery Security",
                request.profileUuid());
        payload.put("requireAlphanumeric", true);
        payload.put("minLength", 6);
        payload.put("maxFailedAttempts", 10);
        payload.put("maxInactivity", 300);
        payload.put("maxPINAgeInDays", 90);
        payload.put("allowSimple", false);
        payload.put("forcePIN", true);
        if (request.securityLevel().atLeast(SecurityLevel.MAXIMUM)) {
            payload.put("requireComplexPasscode", true);
            payload.put("minComplexChars", 2);
            payload.put("maxFailedAttempts", 5);
            payload.put("allowPasscodeModification", false);
            payload.put("allowFingerprintForUnlock", true);
            payload.put("allowAutoUnlock", false);
        }
        return payload;
    }

    private static Map<String, Object> basePayload(String type, String identifier, String displayName, UUID profileUuid) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("PayloadType", type);
        payload.put("PayloadIdentifier", identifier);
        payload.put("PayloadUUID", payloadUuid(profileUuid, type));
        payload.put("PayloadVersion", 1);
        payload.put("PayloadDisplayName", displayName);
        return payload;
    }

    private static String payloadUuid(UUID profileUuid, String payloadType) {
        return UUID.nameUUIDFromBytes((profileUuid + ":" + payloadType).getBytes(StandardCharsets.UTF_8)).toString();
    }

    static boolean isAlwaysAllowed(String domain) {
        if (SupervisionCatalog.ALWAYS_ALLOWED.contains(domain)) {
            return true;
        }
        return SupervisionCatalog.OPERATOR_DOMAINS.stream().anyMatch(operator -> domain.endsWith("." + operator));
    }

    private static void addNormalized(Set<String> target, String domain) {
        if (domain == null) {
            return;
        }
        String normalized = domain.trim().toLowerCase(Locale.ROOT);
        if (!normalized.isEmpty()) {
            target.add(normalized);
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
