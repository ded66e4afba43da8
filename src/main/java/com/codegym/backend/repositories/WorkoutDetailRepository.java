package com.codegym.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.codegym.backend.entities.WorkoutDetail;

public interface WorkoutDetailRepository extends JpaRepository<WorkoutDetail, UUID> {

    boolean existsByExerciseId(UUID exerciseId);
}
