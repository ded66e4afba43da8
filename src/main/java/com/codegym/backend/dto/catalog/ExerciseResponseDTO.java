package com.codegym.backend.dto.catalog;

import lombok.Data;

@Data
public class ExerciseResponseDTO {
    private String id;
    private String name;
    private String description;
    private String bodyPart;
}
