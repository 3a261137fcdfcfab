package com.altrii.mdm.modules.profile.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public record ConfigurationProfile(
        String identifier,
        UUID profileUuid,
        String displayName,
        SecurityLevel securityLevel,
        Map<String, Object> document
) {

    public static final String PAYLOAD_CONTENT = "PayloadContent";

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> payloads() {
        Object content = document.get(PAYLOAD_CONTENT);
        return content instanceof List<?> list ? (List<Map<String, Object>>) list : List.of();
    }

    public Optional<Map<String, Object>> payload(String payloadType) {
        return payloads().stream()
                .filter(payload -> payloadType.equals(payload.get("PayloadType")))
                .findFirst();
    }

    public boolean removalDisallowed() {
        return Boolean.TRUE.equals(document.get("PayloadRemovalDisallowed"));
    }
}
