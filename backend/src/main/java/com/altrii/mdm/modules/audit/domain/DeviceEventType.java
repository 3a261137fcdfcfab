package com.altrii.mdm.modules.audit.domain;

import java.util.Locale;

public enum DeviceEventType {
    AUTHENTICATED,
    TOKEN_UPDATED,
    UNENROLLED,
    COMMAND_RESPONSE,
    COMMAND_CANCELLED,
    SECURITY_INFO_UPDATED,
    PROHIBITED_APPS_DETECTED,
    RESTRICTION_VIOLATIONS,
    DEVICE_LOCK_FAILURES,
    PROFILE_GENERATED,
    PROFILE_DOWNLOADED,
    ENROLLED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
