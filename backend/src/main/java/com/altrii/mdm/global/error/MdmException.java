package com.altrii.mdm.global.error;

public class MdmException extends ProblemException {

    private final MdmErrorCode errorCode;

    public MdmException(MdmErrorCode errorCode) {
        this(errorCode, null);
    }

    public MdmException(MdmErrorCode errorCode, String detail) {
        super(errorCode.status(), errorCode.name(), detail);
        this.errorCode = errorCode;
    }

    public MdmErrorCode getErrorCode() {
        return errorCode;
    }
}
