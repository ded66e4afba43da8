package com.codegym.backend.mappers;

import com.codegym.backend.dto.invoice.InvoiceResponseDTO;
import com.codegym.backend.entities.Invoice;
import com.codegym.backend.services.util.CurrencyFormatter;

public class InvoiceMapper {

    private InvoiceMapper() {
    }

    public static InvoiceResponseDTO toResponseDTO(Invoice invoice) {
        if (invoice == null) return null;

        InvoiceResponseDTO dto = new InvoiceResponseDTO();
        dto.setId(invoice.getId() != null ? invoice.getId().toString() : null);
        if (invoice.getMember() != null) {
            dto.setMemberId(invoice.getMember().getId().toString());
            dto.setMemberName(invoice.getMember().getFullName());
        }
        if (invoice.getMembershipPackage() != null) {
            dto.setPackageId(invoice.getMembershipPackage().getId().toString());
            dto.setPackageName(invoice.getMembershipPackage().getName());
        }
        dto.setAmount(invoice.getAmount());
        dto.setFormattedAmount(CurrencyFormatter.formatVnd(invoice.getAmount()));
        dto.setCreatedAt(invoice.getCreatedAt());
        return dto;
    }
}
