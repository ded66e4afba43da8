package com.codegym.backend.dto.invoice;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import lombok.Data;

@Data
public class InvoiceResponseDTO {
    private String id;
    private String memberId;
    private String memberName;
    private String packageId;
    private String packageName;
    private BigDecimal amount;
    private String formattedAmount;
    private LocalDateTime createdAt;
}
