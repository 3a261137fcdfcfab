package com.altrii.mdm.modules.command.domain;

import java.util.Map;
import java.util.UUID;

public record CommandReport(
        CommandResponseStatus status,
        UUID commandUuid,
        Map<String, Object> body
) {

    public boolean isIdle() {
        return status == CommandResponseStatus.IDLE;
    }
}
