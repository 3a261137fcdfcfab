package com.altrii.mdm.modules.checkin.application;

import java.util.Arrays;
import java.util.Map;

import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.altrii.mdm.global.plist.PlistValues;
import com.altrii.mdm.modules.checkin.domain.CheckInMessage;
import com.altrii.mdm.modules.checkin.domain.CheckInMessage.Kind;

import org.springframework.stereotype.Component;

@Component
public class CheckInMessageParser {

    public CheckInMessage parse(Map<String, Object> body) {
        String messageType = PlistValues.string(body, "MessageType")
                .orElseThrow(() -> new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "MessageType is missing"));
        Kind kind = Arrays.stream(Kind.values())
                .filter(candidate -> candidate.messageType().equals(messageType))
                .findFirst()
                .orElseThrow(() -> new MdmException(MdmErrorCode.UNSUPPORTED_MESSAGE_TYPE,
                        "Unsupported check-in message " + messageType));

        return switch (kind) {
            case AUTHENTICATE -> new CheckInMessage.Authenticate(
                    PlistValues.string(body, "UDID")
                            .orElseThrow(() -> new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "UDID is missing")),
                    PlistValues.string(body, "SerialNumber").orElse(null),
                    PlistValues.string(body, "Model").orElse(null),
                    PlistValues.string(body, "OSVersion").orElse(null),
                    PlistValues.string(body, "BuildVersion").orElse(null),
                    PlistValues.bool(body, "IsSupervised")
            );
            case TOKEN_UPDATE -> new CheckInMessage.TokenUpdate(
                    PlistValues.bytes(body, "Token")
                            .orElseThrow(() -> new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "Token is missing")),
                    PlistValues.string(body, "PushMagic")
                            .orElseThrow(() -> new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "PushMagic is missing")),
                    PlistValues.bytes(body, "UnlockToken").orElse(null)
            );
            case CHECK_OUT -> new CheckInMessage.CheckOut(PlistValues.string(body, "Reason").orElse("User initiated"));
        };
    }
}
