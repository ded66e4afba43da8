package com.codegym.backend.email.events;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published once a new member and their first invoice are stored.
 */
public record MemberRegisteredEvent(
        UUID memberId,
        String fullName,
        String email,
        String packageName,
        int durationMonths,
        BigDecimal amount,
        LocalDate activeUntil
) {
}
