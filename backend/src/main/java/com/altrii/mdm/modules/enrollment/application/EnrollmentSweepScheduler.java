package com.altrii.mdm.modules.enrollment.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class EnrollmentSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(EnrollmentSweepScheduler.class);

    private final EnrollmentRegistrar enrollmentRegistrar;

    public EnrollmentSweepScheduler(EnrollmentRegistrar enrollmentRegistrar) {
        this.enrollmentRegistrar = enrollmentRegistrar;
    }

    @Scheduled(fixedDelayString = "${mdm.enrollment.sweep-interval:PT15M}")
    public void sweepExpiredTickets() {
        int expired = enrollmentRegistrar.sweepExpired();
        if (expired > 0) {
            log.info("Expired {} enrollment codes", expired);
        }
    }
}
