package com.codegym.backend.controllers;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.codegym.backend.dto.ApiResponse;
import com.codegym.backend.dto.catalog.ExerciseResponseDTO;
import com.codegym.backend.dto.plan.TrainerMemberDTO;
import com.codegym.backend.dto.plan.WorkoutPlanRequestDTO;
import com.codegym.backend.dto.plan.WorkoutPlanResponseDTO;
import com.codegym.backend.services.ExerciseService;
import com.codegym.backend.services.SystemConfigService;
import com.codegym.backend.services.WorkoutPlanService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/trainer")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('TRAINER', 'ADMIN')")
public class TrainerController {

    private final WorkoutPlanService workoutPlanService;
    private final ExerciseService exerciseService;
    private final SystemConfigService systemConfigService;

    @GetMapping("/members")
    public ResponseEntity<ApiResponse<List<TrainerMemberDTO>>> listMembers() {
        return ResponseEntity.ok(ApiResponse.success(workoutPlanService.listMembersForCurrentTrainer()));
    }

    @GetMapping("/members/{memberId}/plans")
    public ResponseEntity<ApiResponse<List<WorkoutPlanResponseDTO>>> listPlans(@PathVariable String memberId) {
        return ResponseEntity.ok(ApiResponse.success(workoutPlanService.listPlans(memberId)));
    }

    @PostMapping("/members/{memberId}/plans")
    public ResponseEntity<ApiResponse<WorkoutPlanResponseDTO>> createPlan(
            @PathVariable String memberId,
            @RequestBody WorkoutPlanRequestDTO request
    ) {
        WorkoutPlanResponseDTO response = workoutPlanService.createPlan(memberId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(response, "Workout plan created"));
    }

    // exercise picker and the current cap for the plan form
    @GetMapping("/exercises")
    public ResponseEntity<ApiResponse<List<ExerciseResponseDTO>>> listExercises() {
        return ResponseEntity.ok(ApiResponse.success(exerciseService.listExercises()));
    }

    @GetMapping("/settings/max-training-days")
    public ResponseEntity<ApiResponse<Integer>> maxTrainingDays() {
        return ResponseEntity.ok(ApiResponse.success(systemConfigService.getMaxTrainingDays()));
    }
}
