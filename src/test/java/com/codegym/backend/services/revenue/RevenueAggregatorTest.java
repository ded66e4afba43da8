package com.codegym.backend.services.revenue;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

class RevenueAggregatorTest {

    private final RevenueAggregator aggregator = new RevenueAggregator();

    @Test
    void noEntries_yieldsTwelveZeros() {
        List<BigDecimal> totals = aggregator.monthlyTotals(List.of(), 2024);

        assertEquals(12, totals.size());
        assertEquals(Collections.nCopies(12, BigDecimal.ZERO), totals);
    }

    @Test
    void entries_areBucketedByCalendarMonthRegardlessOfOrder() {
        List<RevenueEntry> entries = List.of(
                new RevenueEntry(new BigDecimal("3500000"), LocalDateTime.of(2024, 12, 31, 23, 59)),
                new RevenueEntry(new BigDecimal("500000"), LocalDateTime.of(2024, 1, 1, 0, 0)),
                new RevenueEntry(new BigDecimal("1200000"), LocalDateTime.of(2024, 3, 10, 9, 30)),
                new RevenueEntry(new BigDecimal("500000"), LocalDateTime.of(2024, 3, 28, 18, 0))
        );

        List<BigDecimal> totals = aggregator.monthlyTotals(entries, 2024);

        assertEquals(new BigDecimal("500000"), totals.get(0));
        assertEquals(BigDecimal.ZERO, totals.get(1));
        assertEquals(new BigDecimal("1700000"), totals.get(2));
        assertEquals(new BigDecimal("3500000"), totals.get(11));
    }

    @Test
    void entriesOfOtherYears_areExcluded() {
        List<RevenueEntry> entries = List.of(
                new RevenueEntry(new BigDecimal("100"), LocalDateTime.of(2023, 12, 31, 23, 59, 59)),
                new RevenueEntry(new BigDecimal("200"), LocalDateTime.of(2024, 6, 1, 12, 0)),
                new RevenueEntry(new BigDecimal("300"), LocalDateTime.of(2025, 1, 1, 0, 0))
        );

        List<BigDecimal> totals = aggregator.monthlyTotals(entries, 2024);

        assertEquals(new BigDecimal("200"), aggregator.yearTotal(totals));
        assertEquals(new BigDecimal("200"), totals.get(5));
    }

    @Test
    void decimalAmounts_areAddedWithoutRounding() {
        List<RevenueEntry> entries = List.of(
                new RevenueEntry(new BigDecimal("0.10"), LocalDateTime.of(2024, 2, 1, 8, 0)),
                new RevenueEntry(new BigDecimal("0.20"), LocalDateTime.of(2024, 2, 2, 8, 0))
        );

        assertEquals(new BigDecimal("0.30"), aggregator.monthlyTotals(entries, 2024).get(1));
    }
}
