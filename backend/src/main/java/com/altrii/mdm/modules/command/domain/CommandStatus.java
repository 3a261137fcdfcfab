package com.altrii.mdm.modules.command.domain;

import java.util.EnumSet;
import java.util.Set;

public enum CommandStatus {
    PENDING,
    SENT,
    ACKNOWLEDGED,
    FAILED,
    CANCELLED;

    public static final Set<CommandStatus> OUTSTANDING = EnumSet.of(PENDING, SENT);

    public boolean isOutstanding() {
        return OUTSTANDING.contains(this);
    }
}
