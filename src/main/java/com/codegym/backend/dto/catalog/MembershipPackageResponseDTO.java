package com.codegym.backend.dto.catalog;

import java.math.BigDecimal;

import lombok.Data;

@Data
public class MembershipPackageResponseDTO {
    private String id;
    private String name;
    private Integer durationMonths;
    private BigDecimal price;
    private String formattedPrice;
    private String description;
}
