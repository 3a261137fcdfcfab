package com.altrii.mdm.modules.entitlement.application;

import com.altrii.mdm.modules.entitlement.domain.EntitlementTier;

public interface EntitlementDirectory {

    EntitlementTier tierFor(String userId, String deviceId);
}
