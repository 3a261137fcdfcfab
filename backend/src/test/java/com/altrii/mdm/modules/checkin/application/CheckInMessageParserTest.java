package com.altrii.mdm.modules.checkin.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.modules.checkin.domain.CheckInMessage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CheckInMessageParserTest {

    private final CheckInMessageParser parser = new CheckInMessageParser();

    @Test
    @DisplayName("Authenticate carries device identity and the supervised flag")
    void parse_authenticate() {
        CheckInMessage message = parser.parse(Map.of(
                "MessageType", "Authenticate",
                "UDID", "00008110-000A1C2E3F4A",
                "SerialNumber", "F2LXK0ABCD",
                "Model", "iPhone14,5",
                "OSVersion", "17.5",
                "IsSupervised", true));

        assertThat(message).isInstanceOfSatisfying(CheckInMessage.Authenticate.class, authenticate -> {
            assertThat(authenticate.udid()).isEqualTo("00008110-000A1C2E3F4A");
            assertThat(authenticate.osVersion()).isEqualTo("17.5");
            assertThat(authenticate.buildVersion()).isNull();
            assertThat(authenticate.supervised()).isTrue();
        });
    }

    @Test
    @DisplayName("TokenUpdate requires the token and the push magic")
    void parse_tokenUpdate() {
        byte[] token = {1, 2, 3, 4};

        CheckInMessage message = parser.parse(Map.of("MessageType", "TokenUpdate", "Token", token,
                "PushMagic", "magic-1"));

        assertThat(message).isInstanceOfSatisfying(CheckInMessage.TokenUpdate.class, update -> {
            assertThat(update.token()).containsExactly(1, 2, 3, 4);
            assertThat(update.unlockToken()).isNull();
        });
        assertThatThrownBy(() -> parser.parse(Map.of("MessageType", "TokenUpdate", "Token", token)))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.MALFORMED_PAYLOAD);
    }

    @Test
    @DisplayName("CheckOut without a reason defaults to a user initiated one")
    void parse_checkOut() {
        CheckInMessage message = parser.parse(Map.of("MessageType", "CheckOut"));

        assertThat(message).isEqualTo(new CheckInMessage.CheckOut("User initiated"));
    }

    @Test
    @DisplayName("unknown and missing message types are rejected differently")
    void parse_unknownMessageType() {
        assertThatThrownBy(() -> parser.parse(Map.of("MessageType", "DeclarativeManagement")))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.UNSUPPORTED_MESSAGE_TYPE);
        assertThatThrownBy(() -> parser.parse(Map.of("UDID", "abc")))
                .isInstanceOf(MdmException.class)
                .extracting(ex -> ((MdmException) ex).getErrorCode())
                .isEqualTo(MdmErrorCode.MALFORMED_PAYLOAD);
    }
}
