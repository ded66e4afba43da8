package com.codegym.backend.dto.settings;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SystemSettingsDTO {

    @NotNull(message = "Maximum training days is required")
    @Min(value = 1, message = "Maximum training days must be between 1 and 7")
    @Max(value = 7, message = "Maximum training days must be between 1 and 7")
    private Integer maxTrainingDays;
}
