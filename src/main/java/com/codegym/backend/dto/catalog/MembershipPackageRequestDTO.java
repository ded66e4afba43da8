package com.codegym.backend.dto.catalog;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class MembershipPackageRequestDTO {

    @NotBlank(message = "Package name is required")
    @Size(max = 100)
    private String name;

    @NotNull(message = "Duration is required")
    @Min(value = 1, message = "Duration must be at least 1 month")
    private Integer durationMonths;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price cannot be negative")
    private BigDecimal price;

    private String description;
}
