package com.codegym.backend.dto.plan;

import lombok.Data;

@Data
public class WorkoutDetailResponseDTO {
    private String id;
    private String exerciseId;
    private String exerciseName;
    private Integer sets;
    private String reps;
    private String scheduleDay;
}
