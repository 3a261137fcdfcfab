package com.altrii.mdm.modules.command.application;

import java.util.Map;
import java.util.UUID;

import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.global.plist.PlistValues;
import com.altrii.mdm.modules.command.domain.CommandReport;
import com.altrii.mdm.modules.command.domain.CommandResponseStatus;

import org.springframework.stereotype.Component;

@Component
public class CommandReportParser {

    public CommandReport parse(Map<String, Object> body) {
        String rawStatus = PlistValues.string(body, "Status")
                .orElseThrow(() -> new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "Status is missing"));
        CommandResponseStatus status = CommandResponseStatus.fromWireName(rawStatus)
                .orElseThrow(() -> new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "Unknown status " + rawStatus));
        if (status == CommandResponseStatus.IDLE) {
            return new CommandReport(status, null, body);
        }
        String rawUuid = PlistValues.string(body, "CommandUUID")
                .orElseThrow(() -> new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "CommandUUID is missing"));
        try {
            return new CommandReport(status, UUID.fromString(rawUuid), body);
        } catch (IllegalArgumentException ex) {
            throw new MdmException(MdmErrorCode.UNKNOWN_COMMAND, "CommandUUID " + rawUuid + " was never issued");
        }
    }
}
