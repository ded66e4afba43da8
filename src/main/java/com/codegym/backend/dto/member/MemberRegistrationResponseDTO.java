package com.codegym.backend.dto.member;

import com.codegym.backend.dto.invoice.InvoiceResponseDTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MemberRegistrationResponseDTO {
    private MemberResponseDTO member;
    private InvoiceResponseDTO invoice;

    public String getId() {
        return member != null ? member.getId() : null;
    }
}
