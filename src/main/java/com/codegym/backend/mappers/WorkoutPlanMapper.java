package com.codegym.backend.mappers;

import java.util.List;
import java.util.stream.Collectors;

import com.codegym.backend.dto.plan.WorkoutDetailResponseDTO;
import com.codegym.backend.dto.plan.WorkoutPlanResponseDTO;
import com.codegym.backend.entities.WorkoutDetail;
import com.codegym.backend.entities.WorkoutPlan;

public class WorkoutPlanMapper {

    private WorkoutPlanMapper() {
    }

    public static WorkoutPlanResponseDTO toResponseDTO(WorkoutPlan plan) {
        if (plan == null) return null;

        WorkoutPlanResponseDTO dto = new WorkoutPlanResponseDTO();
        dto.setId(plan.getId() != null ? plan.getId().toString() : null);
        dto.setMemberId(plan.getMember().getId().toString());
        dto.setTrainerUsername(plan.getTrainer().getUsername());
        dto.setCreatedAt(plan.getCreatedAt());
        dto.setNotes(plan.getNotes());

        List<WorkoutDetailResponseDTO> details = plan.getDetails().stream()
                .map(WorkoutPlanMapper::toDetailDTO)
                .collect(Collectors.toList());
        dto.setDetails(details);
        return dto;
    }

    private static WorkoutDetailResponseDTO toDetailDTO(WorkoutDetail d) {
        WorkoutDetailResponseDTO dto = new WorkoutDetailResponseDTO();
        dto.setId(d.getId() != null ? d.getId().toString() : null);
        dto.setExerciseId(d.getExercise().getId().toString());
        dto.setExerciseName(d.getExercise().getName());
        dto.setSets(d.getSets());
        dto.setReps(d.getReps());
        dto.setScheduleDay(d.getScheduleDay());
        return dto;
    }
}
