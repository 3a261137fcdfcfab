package com.altrii.mdm.modules.profile.domain;

import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;

public enum SecurityLevel {
    WEB_FILTER(1),
    RESTRICTED(2),
    MAXIMUM(3);

    private final int value;

    SecurityLevel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public boolean atLeast(SecurityLevel other) {
        return value >= other.value;
    }

    public static SecurityLevel of(int value) {
        for (SecurityLevel level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        throw new MdmException(MdmErrorCode.INVALID_SECURITY_LEVEL, "Security level must be 1, 2 or 3, got " + value);
    }
}
