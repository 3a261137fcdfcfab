package com.altrii.mdm.global.error;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds raised by the supervision engine. Protocol violations fail closed without
 * mutating any state.
 */
public enum MdmErrorCode {

    UNKNOWN_DEVICE(HttpStatus.UNAUTHORIZED),
    NO_SESSION(HttpStatus.UNAUTHORIZED),
    UNKNOWN_COMMAND(HttpStatus.CONFLICT),
    UNSUPPORTED_MESSAGE_TYPE(HttpStatus.BAD_REQUEST),
    MALFORMED_PAYLOAD(HttpStatus.BAD_REQUEST),
    INVALID_CODE(HttpStatus.NOT_FOUND),
    EXPIRED(HttpStatus.GONE),
    DEVICE_NOT_FOUND(HttpStatus.NOT_FOUND),
    PROFILE_NOT_FOUND(HttpStatus.NOT_FOUND),
    COMMAND_NOT_FOUND(HttpStatus.NOT_FOUND),
    COMMAND_ALREADY_SENT(HttpStatus.CONFLICT),
    COMMAND_QUEUE_FULL(HttpStatus.TOO_MANY_REQUESTS),
    UNSUPPORTED_COMMAND_TYPE(HttpStatus.BAD_REQUEST),
    INVALID_COMMAND_PARAMETERS(HttpStatus.BAD_REQUEST),
    INVALID_SECURITY_LEVEL(HttpStatus.BAD_REQUEST),
    SECURITY_LEVEL_NOT_ENTITLED(HttpStatus.FORBIDDEN),
    ENROLLMENT_NOT_DOWNLOADED(HttpStatus.CONFLICT);

    private final HttpStatus status;

    MdmErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
