package com.codegym.backend.services.membership;

import java.time.LocalDate;

import org.springframework.stereotype.Component;

import com.codegym.backend.exceptions.InvalidDurationException;

/**
 * Computes the new active-until date of a member after a package is paid.
 *
 * The anchor is the current expiry when it is still valid (today or later),
 * otherwise today. A lapsed membership never gets backdated time and an
 * active one keeps what is left of it.
 */
@Component
public class MembershipExtension {

    public LocalDate extend(LocalDate currentActiveUntil, int durationMonths, LocalDate today) {
        if (durationMonths < 1) {
            throw new InvalidDurationException(durationMonths);
        }
        if (today == null) {
            throw new IllegalArgumentException("today is required");
        }

        LocalDate anchor = anchorDate(currentActiveUntil, today);

        // plusMonths clamps the day-of-month to the last valid day (Jan 31 -> Feb 28/29)
        return anchor.plusMonths(durationMonths);
    }

    public LocalDate anchorDate(LocalDate currentActiveUntil, LocalDate today) {
        if (currentActiveUntil != null && !currentActiveUntil.isBefore(today)) {
            return currentActiveUntil;
        }
        return today;
    }
}
