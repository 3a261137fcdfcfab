package com.altrii.mdm.modules.entitlement.infrastructure;

import java.util.Locale;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.modules.entitlement.application.EntitlementDirectory;
import com.altrii.mdm.modules.entitlement.domain.EntitlementTier;

import org.springframework.stereotype.Component;

@Component
public class ConfiguredEntitlementDirectory implements EntitlementDirectory {

    private final EntitlementTier defaultTier;

    public ConfiguredEntitlementDirectory(MdmProperties properties) {
        this.defaultTier = EntitlementTier.valueOf(
                properties.getEntitlement().getDefaultTier().trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public EntitlementTier tierFor(String userId, String deviceId) {
        return defaultTier;
    }
}
