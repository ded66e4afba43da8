package com.codegym.backend.services;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.audit.Auditable;
import com.codegym.backend.dto.catalog.ExerciseRequestDTO;
import com.codegym.backend.dto.catalog.ExerciseResponseDTO;
import com.codegym.backend.entities.Exercise;
import com.codegym.backend.exceptions.ConflictException;
import com.codegym.backend.exceptions.ResourceNotFoundException;
import com.codegym.backend.mappers.CatalogMapper;
import com.codegym.backend.repositories.ExerciseRepository;
import com.codegym.backend.repositories.WorkoutDetailRepository;
import com.codegym.backend.services.util.EntityIds;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ExerciseService {

    private final ExerciseRepository exerciseRepository;
    private final WorkoutDetailRepository workoutDetailRepository;

    @Transactional(readOnly = true)
    public List<ExerciseResponseDTO> listExercises() {
        return exerciseRepository.findAllByOrderByNameAsc().stream()
                .map(CatalogMapper::toResponseDTO)
                .toList();
    }

    public Exercise findById(String id) {
        UUID uuid = EntityIds.parseExisting(id, "Exercise");
        return exerciseRepository.findById(uuid)
                .orElseThrow(() -> new ResourceNotFoundException("Exercise not found"));
    }

    @Auditable(action = "EXERCISE_CREATED", entityType = "Exercise")
    @Transactional
    public ExerciseResponseDTO create(ExerciseRequestDTO request) {
        Exercise exercise = new Exercise();
        CatalogMapper.apply(request, exercise);
        return CatalogMapper.toResponseDTO(exerciseRepository.save(exercise));
    }

    @Auditable(action = "EXERCISE_UPDATED", entityType = "Exercise")
    @Transactional
    public ExerciseResponseDTO update(String id, ExerciseRequestDTO request) {
        Exercise exercise = findById(id);
        CatalogMapper.apply(request, exercise);
        return CatalogMapper.toResponseDTO(exerciseRepository.save(exercise));
    }

    @Auditable(action = "EXERCISE_DELETED", entityType = "Exercise")
    @Transactional
    public void delete(String id) {
        Exercise exercise = findById(id);
        if (workoutDetailRepository.existsByExerciseId(exercise.getId())) {
            throw new ConflictException("Exercise '" + exercise.getName() + "' is used in workout plans and cannot be deleted");
        }
        exerciseRepository.delete(exercise);
    }
}
