package com.altrii.mdm.modules.supervision.presentation.dto;

import java.util.List;
import java.util.Set;

import com.altrii.mdm.modules.device.domain.BlockCategory;
import com.altrii.mdm.modules.profile.domain.BlockingPolicy;

public record BlockingSettingsRequest(
        Set<BlockCategory> blockedCategories,
        List<String> customBlockedDomains,
        List<String> customAllowedDomains,
        List<String> additionalBlockedApps,
        Boolean allowJavaScript
) {

    public BlockingPolicy toPolicy() {
        Set<BlockCategory> categories = blockedCategories == null
                ? BlockingPolicy.defaults().blockedCategories()
                : blockedCategories;
        return new BlockingPolicy(categories, customBlockedDomains, customAllowedDomains, additionalBlockedApps,
                !Boolean.FALSE.equals(allowJavaScript));
    }
}
