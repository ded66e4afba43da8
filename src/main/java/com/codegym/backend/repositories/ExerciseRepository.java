package com.codegym.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.codegym.backend.entities.Exercise;

public interface ExerciseRepository extends JpaRepository<Exercise, UUID> {

    List<Exercise> findAllByOrderByNameAsc();

    boolean existsByNameIgnoreCase(String name);
}
