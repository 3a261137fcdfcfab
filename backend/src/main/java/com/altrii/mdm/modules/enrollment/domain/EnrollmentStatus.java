package com.altrii.mdm.modules.enrollment.domain;

public enum EnrollmentStatus {
    ISSUED,
    DOWNLOADED,
    ENROLLED,
    EXPIRED
}
