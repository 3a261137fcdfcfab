package com.altrii.mdm.modules.profile.domain;

public class ProfileSigningException extends RuntimeException {

    public ProfileSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
