package com.codegym.backend.controllers.admin;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.codegym.backend.dto.ApiResponse;
import com.codegym.backend.dto.catalog.ExerciseRequestDTO;
import com.codegym.backend.dto.catalog.ExerciseResponseDTO;
import com.codegym.backend.services.ExerciseService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/admin/exercises")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminExerciseController {

    private final ExerciseService exerciseService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<ExerciseResponseDTO>>> list() {
        return ResponseEntity.ok(ApiResponse.success(exerciseService.listExercises()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ExerciseResponseDTO>> create(@Valid @RequestBody ExerciseRequestDTO request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(exerciseService.create(request), "Exercise created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ExerciseResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody ExerciseRequestDTO request
    ) {
        return ResponseEntity.ok(ApiResponse.success(exerciseService.update(id, request), "Exercise updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        exerciseService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Exercise deleted"));
    }
}
