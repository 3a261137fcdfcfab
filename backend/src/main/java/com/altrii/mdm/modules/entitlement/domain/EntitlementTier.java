package com.altrii.mdm.modules.entitlement.domain;

public enum EntitlementTier {
    FREE(1, 10),
    BASIC(1, 20),
    PREMIUM(3, 50);

    private final int maxSecurityLevel;
    private final int maxOutstandingCommands;

    EntitlementTier(int maxSecurityLevel, int maxOutstandingCommands) {
        this.maxSecurityLevel = maxSecurityLevel;
        this.maxOutstandingCommands = maxOutstandingCommands;
    }

    public int maxSecurityLevel() {
        return maxSecurityLevel;
    }

    public int maxOutstandingCommands() {
        return maxOutstandingCommands;
    }

    public boolean permitsSecurityLevel(int level) {
        return level <= maxSecurityLevel;
    }
}
