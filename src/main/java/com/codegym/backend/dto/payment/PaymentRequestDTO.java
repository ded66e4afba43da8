package com.codegym.backend.dto.payment;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PaymentRequestDTO {

    @NotBlank(message = "Member is required")
    private String memberId;

    @NotBlank(message = "Package is required")
    private String packageId;
}
