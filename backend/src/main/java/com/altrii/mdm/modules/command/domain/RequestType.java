package com.altrii.mdm.modules.command.domain;

import java.util.Arrays;
import java.util.Optional;

public enum RequestType {
    PROFILE_LIST("ProfileList"),
    SECURITY_INFO("SecurityInfo"),
    RESTRICTIONS("Restrictions"),
    INSTALLED_APPLICATION_LIST("InstalledApplicationList"),
    DEVICE_INFORMATION("DeviceInformation"),
    INSTALL_PROFILE("InstallProfile"),
    REMOVE_PROFILE("RemoveProfile"),
    SETTINGS("Settings"),
    DEVICE_LOCK("DeviceLock");

    private final String wireName;

    RequestType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RequestType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst();
    }
}
