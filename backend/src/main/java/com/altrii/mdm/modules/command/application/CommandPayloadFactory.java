package com.altrii.mdm.modules.command.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.modules.command.domain.MdmCommand;
import com.altrii.mdm.modules.command.domain.RequestType;
import com.altrii.mdm.modules.profile.domain.SupervisionProfile;
import com.altrii.mdm.modules.profile.infrastructure.persistence.SupervisionProfileRepository;

import org.springframework.stereotype.Component;

@Component
public class CommandPayloadFactory {

    static final List<String> DEFAULT_DEVICE_QUERIES = List.of(
            "DeviceName", "OSVersion", "BuildVersion", "ModelName", "Model", "SerialNumber", "IsSupervised"
    );

    private static final Pattern DEVICE_LOCK_PIN = Pattern.compile("\\d{6}");

    private final SupervisionProfileRepository supervisionProfileRepository;

    public CommandPayloadFactory(SupervisionProfileRepository supervisionProfileRepository) {
        this.supervisionProfileRepository = supervisionProfileRepository;
    }

    public Map<String, Object> normalize(String deviceId, RequestType requestType, Map<String, Object> parameters) {
        Map<String, Object> params = parameters == null ? Map.of() : parameters;
        Map<String, Object> payload = new LinkedHashMap<>();
        switch (requestType) {
            case PROFILE_LIST, SECURITY_INFO, RESTRICTIONS -> {
            }
            case INSTALLED_APPLICATION_LIST -> {
                if (params.get("managedAppsOnly") instanceof Boolean managedOnly) {
                    payload.put("ManagedAppsOnly", managedOnly);
                }
            }
            case DEVICE_INFORMATION -> payload.put("Queries", stringList(params.get("queries"), DEFAULT_DEVICE_QUERIES));
            case INSTALL_PROFILE -> {
                SupervisionProfile profile = resolveProfile(deviceId, params.get("profileId"));
                payload.put("profileId", profile.getProfileUuid().toString());
            }
            case REMOVE_PROFILE -> payload.put("Identifier", requireText(params, "profileIdentifier"));
            case SETTINGS -> {
                Object settings = params.get("settings");
                if (!(settings instanceof List<?> list) || list.isEmpty()) {
                    throw invalid("settings must be a non-empty list");
                }
                payload.put("Settings", list);
            }
            case DEVICE_LOCK -> {
                Object pin = params.get("pin");
                if (pin != null) {
                    if (!DEVICE_LOCK_PIN.matcher(pin.toString()).matches()) {
                        throw invalid("pin must be six digits");
                    }
                    payload.put("PIN", pin.toString());
                }
                optionalText(params, "message").ifPresent(message -> payload.put("Message", message));
                optionalText(params, "phoneNumber").ifPresent(phone -> payload.put("PhoneNumber", phone));
            }
        }
        return payload;
    }

    public Map<String, Object> render(MdmCommand command) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("RequestType", command.getRequestType().wireName());
        Map<String, Object> payload = command.getPayload() == null ? Map.of() : command.getPayload();
        if (command.getRequestType() == RequestType.INSTALL_PROFILE) {
            UUID profileUuid = UUID.fromString(String.valueOf(payload.get("profileId")));
            SupervisionProfile profile = supervisionProfileRepository.findByProfileUuid(profileUuid)
                    .orElseThrow(() -> new MdmException(MdmErrorCode.PROFILE_NOT_FOUND,
                            "Profile " + profileUuid + " was replaced or removed"));
            body.put("Payload", profile.getProfileData());
        } else {
            body.putAll(payload);
        }

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("CommandUUID", command.getCommandUuid().toString());
        envelope.put("Command", body);
        return envelope;
    }

    private SupervisionProfile resolveProfile(String deviceId, Object profileId) {
        if (profileId == null) {
            return supervisionProfileRepository.findFirstByDeviceIdOrderByUpdatedAtDesc(deviceId)
                    .orElseThrow(() -> new MdmException(MdmErrorCode.PROFILE_NOT_FOUND,
                            "No supervision profile generated for device " + deviceId));
        }
        UUID profileUuid;
        try {
            profileUuid = UUID.fromString(profileId.toString());
        } catch (IllegalArgumentException ex) {
            throw invalid("profileId must be a UUID");
        }
        return supervisionProfileRepository.findByProfileUuid(profileUuid)
                .filter(profile -> profile.getDeviceId().equals(deviceId))
                .orElseThrow(() -> new MdmException(MdmErrorCode.PROFILE_NOT_FOUND));
    }

    private static List<String> stringList(Object value, List<String> fallback) {
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof List<?> list) || list.stream().anyMatch(item -> !(item instanceof String))) {
            throw invalid("queries must be a list of strings");
        }
        return list.stream().map(String.class::cast).toList();
    }

    private static String requireText(Map<String, Object> params, String key) {
        return optionalText(params, key).orElseThrow(() -> invalid(key + " is required"));
    }

    private static Optional<String> optionalText(Map<String, Object> params, String key) {
        Object value = params.get(key);
        return value instanceof String text && !text.isBlank()
                ? Optional.of(text.trim())
                : Optional.empty();
    }

    private static MdmException invalid(String detail) {
        return new MdmException(MdmErrorCode.INVALID_COMMAND_PARAMETERS, detail);
    }
}
