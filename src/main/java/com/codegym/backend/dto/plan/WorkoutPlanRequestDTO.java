package com.codegym.backend.dto.plan;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

@Data
public class WorkoutPlanRequestDTO {
    private String notes;
    private List<WorkoutRowDTO> rows = new ArrayList<>();
}
