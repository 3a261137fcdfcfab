package com.altrii.mdm.modules.command.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.UUID;

import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.modules.command.domain.CommandReport;
import com.altrii.mdm.modules.command.domain.CommandResponseStatus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommandReportParserTest {

    private final CommandReportParser parser = new CommandReportParser();

    @Test
    @DisplayName("Idle carries no command id")
    void parse_idle() {
        CommandReport report = parser.parse(Map.of("Status", "Idle", "UDID", "abc"));

        assertThat(report.isIdle()).isTrue();
        assertThat(report.commandUuid()).isNull();
    }

    @Test
    @DisplayName("an acknowledgement keeps the whole body for reconciliation")
    void parse_acknowledged() {
        UUID commandUuid = UUID.randomUUID();
        Map<String, Object> body = Map.of("Status", "Acknowledged", "CommandUUID", commandUuid.toString(),
                "SecurityInfo", Map.of("IsSupervised", true));

        CommandReport report = parser.parse(body);

        assertThat(report.status()).isEqualTo(CommandResponseStatus.ACKNOWLEDGED);
        assertThat(report.commandUuid()).isEqualTo(commandUuid);
        assertThat(report.body()).containsKey("SecurityInfo");
    }

    @Test
    @DisplayName("missing or unknown Status is a malformed payload")
    void parse_badStatus() {
        assertThatThrownBy(() -> parser.parse(Map.of("CommandUUID", UUID.randomUUID().toString())))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.MALFORMED_PAYLOAD);
        assertThatThrownBy(() -> parser.parse(Map.of("Status", "Pending")))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.MALFORMED_PAYLOAD);
    }

    @Test
    @DisplayName("a CommandUUID that is not a UUID can never match an issued command")
    void parse_unparseableCommandUuid() {
        assertThatThrownBy(() -> parser.parse(Map.of("Status", "Error", "CommandUUID", "not-a-uuid")))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.UNKNOWN_COMMAND);
    }
}
