package com.codegym.backend.dto.revenue;

import java.math.BigDecimal;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueReportDTO {
    private int year;
    private List<MonthlyRevenueDTO> months;
    private BigDecimal total;
    private String formattedTotal;
}
