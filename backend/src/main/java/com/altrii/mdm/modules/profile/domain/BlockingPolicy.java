package com.altrii.mdm.modules.profile.domain;

import java.util.List;
import java.util.Set;

import com.altrii.mdm.modules.device.domain.BlockCategory;

public record BlockingPolicy(
        Set<BlockCategory> blockedCategories,
        List<String> customBlockedDomains,
        List<String> customAllowedDomains,
        List<String> additionalBlockedApps,
        boolean allowJavaScript
) {

    public BlockingPolicy {
        blockedCategories = blockedCategories == null ? Set.of() : Set.copyOf(blockedCategories);
        customBlockedDomains = customBlockedDomains == null ? List.of() : List.copyOf(customBlockedDomains);
        customAllowedDomains = customAllowedDomains == null ? List.of() : List.copyOf(customAllowedDomains);
        additionalBlockedApps = additionalBlockedApps == null ? List.of() : List.copyOf(additionalBlockedApps);
    }

    public static BlockingPolicy defaults() {
        return new BlockingPolicy(Set.of(BlockCategory.ADULT, BlockCategory.GAMBLING), List.of(), List.of(), List.of(), true);
    }
}
