package com.codegym.backend.services;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.dto.revenue.MonthlyRevenueDTO;
import com.codegym.backend.dto.revenue.RevenueReportDTO;
import com.codegym.backend.exceptions.BadRequestException;
import com.codegym.backend.repositories.InvoiceRepository;
import com.codegym.backend.services.revenue.RevenueAggregator;
import com.codegym.backend.services.revenue.RevenueEntry;
import com.codegym.backend.services.util.CurrencyFormatter;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class RevenueService {

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 9999;

    private final InvoiceRepository invoiceRepository;
    private final RevenueAggregator revenueAggregator;
    private final Clock clock;

    private int currentYear() {
        return LocalDate.now(clock).getYear();
    }

    /**
     * Monthly invoice totals for the year, or for the current year when
     * {@code year} is null.
     */
    @Transactional(readOnly = true)
    public RevenueReportDTO monthlyRevenue(Integer year) {
        int target = year != null ? year : currentYear();
        if (target < MIN_YEAR || target > MAX_YEAR) {
            throw new BadRequestException("Year must be between " + MIN_YEAR + " and " + MAX_YEAR);
        }

        List<RevenueEntry> entries = invoiceRepository.findRevenueEntries(
                LocalDateTime.of(target, 1, 1, 0, 0),
                LocalDateTime.of(target + 1, 1, 1, 0, 0)
        );
        List<BigDecimal> totals = revenueAggregator.monthlyTotals(entries, target);

        List<MonthlyRevenueDTO> months = new ArrayList<>(RevenueAggregator.MONTHS);
        for (int i = 0; i < RevenueAggregator.MONTHS; i++) {
            Month month = Month.of(i + 1);
            months.add(new MonthlyRevenueDTO(
                    month.getValue(),
                    month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH),
                    totals.get(i)
            ));
        }

        BigDecimal total = revenueAggregator.yearTotal(totals);
        return RevenueReportDTO.builder()
                .year(target)
                .months(months)
                .total(total)
                .formattedTotal(CurrencyFormatter.formatVnd(total))
                .build();
    }
}
