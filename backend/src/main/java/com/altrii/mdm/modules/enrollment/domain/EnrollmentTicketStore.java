package com.altrii.mdm.modules.enrollment.domain;

import java.time.Instant;
import java.util.Optional;

public interface EnrollmentTicketStore {

    void save(EnrollmentTicket ticket);

    Optional<EnrollmentTicket> find(String code);

    void remove(String code);

    /**
     * @return number of tickets evicted
     */
    int removeExpired(Instant now);
}
