package com.altrii.mdm.modules.command.domain;

import java.util.Arrays;
import java.util.Optional;

public enum CommandResponseStatus {
    ACKNOWLEDGED("Acknowledged"),
    ERROR("Error"),
    COMMAND_FORMAT_ERROR("CommandFormatError"),
    NOT_NOW("NotNow"),
    IDLE("Idle");

    private final String wireName;

    CommandResponseStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<CommandResponseStatus> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireName.equals(value))
                .findFirst();
    }
}
