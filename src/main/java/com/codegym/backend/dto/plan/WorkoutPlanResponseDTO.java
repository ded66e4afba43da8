package com.codegym.backend.dto.plan;

import java.time.LocalDateTime;
import java.util.List;

import lombok.Data;

@Data
public class WorkoutPlanResponseDTO {
    private String id;
    private String memberId;
    private String trainerUsername;
    private LocalDateTime createdAt;
    private String notes;
    private List<WorkoutDetailResponseDTO> details;
}
