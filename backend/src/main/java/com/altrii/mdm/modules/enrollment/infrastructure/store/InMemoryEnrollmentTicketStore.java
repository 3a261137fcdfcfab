package com.altrii.mdm.modules.enrollment.infrastructure.store;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.altrii.mdm.modules.enrollment.domain.EnrollmentTicket;
import com.altrii.mdm.modules.enrollment.domain.EnrollmentTicketStore;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "mdm.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryEnrollmentTicketStore implements EnrollmentTicketStore {

    private final ConcurrentMap<String, EnrollmentTicket> tickets = new ConcurrentHashMap<>();

    @Override
    public void save(EnrollmentTicket ticket) {
        tickets.put(ticket.code(), ticket);
    }

    @Override
    public Optional<EnrollmentTicket> find(String code) {
        return Optional.ofNullable(tickets.get(code));
    }

    @Override
    public void remove(String code) {
        tickets.remove(code);
    }

    @Override
    public int removeExpired(Instant now) {
        int before = tickets.size();
        tickets.values().removeIf(ticket -> ticket.isExpiredAt(now));
        return Math.max(before - tickets.size(), 0);
    }
}
