package com.codegym.backend.services.revenue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Component;

/**
 * Buckets invoice amounts into calendar months of one year.
 */
@Component
public class RevenueAggregator {

    public static final int MONTHS = 12;

    /**
     * @return twelve totals, index 0 = January through index 11 = December.
     *         Months without entries are zero; entries of other years are ignored.
     */
    public List<BigDecimal> monthlyTotals(Collection<RevenueEntry> entries, int year) {
        List<BigDecimal> totals = new ArrayList<>(Collections.nCopies(MONTHS, BigDecimal.ZERO));
        if (entries == null) {
            return totals;
        }

        for (RevenueEntry entry : entries) {
            if (entry == null || entry.timestamp() == null || entry.amount() == null) {
                continue;
            }
            if (entry.timestamp().getYear() != year) {
                continue;
            }
            int index = entry.timestamp().getMonthValue() - 1;
            totals.set(index, totals.get(index).add(entry.amount()));
        }

        return totals;
    }

    public BigDecimal yearTotal(List<BigDecimal> monthlyTotals) {
        return monthlyTotals.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
