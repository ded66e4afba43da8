package com.codegym.backend.services.revenue;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record RevenueEntry(BigDecimal amount, LocalDateTime timestamp) {
}
