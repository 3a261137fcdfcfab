package com.altrii.mdm.modules.enrollment.application;

import java.security.SecureRandom;

import com.altrii.mdm.global.config.MdmProperties;

import org.springframework.stereotype.Component;

@Component
public class EnrollmentCodeGenerator {

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private final SecureRandom random = new SecureRandom();
    private final int length;

    public EnrollmentCodeGenerator(MdmProperties properties) {
        this.length = properties.getEnrollment().getCodeLength();
    }

    public String nextCode() {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
