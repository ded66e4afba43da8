package com.codegym.backend.dto.catalog;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ExerciseRequestDTO {

    @NotBlank(message = "Exercise name is required")
    @Size(max = 100)
    private String name;

    private String description;

    @Size(max = 100)
    private String bodyPart;
}
