package com.codegym.backend.dto.payment;

import java.time.LocalDate;

import com.codegym.backend.dto.invoice.InvoiceResponseDTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResponseDTO {
    private InvoiceResponseDTO invoice;
    private LocalDate previousActiveUntil;
    private LocalDate activeUntil;

    public String getId() {
        return invoice != null ? invoice.getId() : null;
    }
}
