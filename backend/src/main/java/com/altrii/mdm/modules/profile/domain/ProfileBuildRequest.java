package com.altrii.mdm.modules.profile.domain;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

public record ProfileBuildRequest(
        String deviceId,
        UUID profileUuid,
        SecurityLevel securityLevel,
        BlockingPolicy policy,
        boolean webOnly,
        Set<String> categoryDomains
) {

    public ProfileBuildRequest {
        Objects.requireNonNull(deviceId, "deviceId is required");
        Objects.requireNonNull(profileUuid, "profileUuid is required");
        Objects.requireNonNull(securityLevel, "securityLevel is required");
        policy = policy == null ? BlockingPolicy.defaults() : policy;
        categoryDomains = categoryDomains == null ? Set.of() : categoryDomains;
    }
}
