package com.altrii.mdm.modules.checkin.domain;

/**
 * Check-in message kinds a device sends to the check-in endpoint.
 */
public sealed interface CheckInMessage
        permits CheckInMessage.Authenticate, CheckInMessage.TokenUpdate, CheckInMessage.CheckOut {

    Kind kind();

    enum Kind {
        AUTHENTICATE("Authenticate"),
        TOKEN_UPDATE("TokenUpdate"),
        CHECK_OUT("CheckOut");

        private final String messageType;

        Kind(String messageType) {
            this.messageType = messageType;
        }

        public String messageType() {
            return messageType;
        }
    }

    record Authenticate(
            String udid,
            String serialNumber,
            String model,
            String osVersion,
            String buildVersion,
            boolean supervised
    ) implements CheckInMessage {

        @Override
        public Kind kind() {
            return Kind.AUTHENTICATE;
        }
    }

    record TokenUpdate(
            byte[] token,
            String pushMagic,
            byte[] unlockToken
    ) implements CheckInMessage {

        @Override
        public Kind kind() {
            return Kind.TOKEN_UPDATE;
        }
    }

    record CheckOut(String reason) implements CheckInMessage {

        @Override
        public Kind kind() {
            return Kind.CHECK_OUT;
        }
    }
}
