package com.codegym.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.codegym.backend.entities.WorkoutPlan;

public interface WorkoutPlanRepository extends JpaRepository<WorkoutPlan, UUID> {

    @Query("""
            SELECT DISTINCT p FROM WorkoutPlan p
            JOIN FETCH p.trainer
            LEFT JOIN FETCH p.details d
            LEFT JOIN FETCH d.exercise
            WHERE p.member.id = :memberId
            ORDER BY p.createdAt DESC
            """)
    List<WorkoutPlan> findByMemberIdWithDetails(@Param("memberId") UUID memberId);

    @Query("""
            SELECT p.member.id, COUNT(p) FROM WorkoutPlan p
            WHERE p.trainer.id = :trainerId
            GROUP BY p.member.id
            """)
    List<Object[]> countPlansPerMemberForTrainer(@Param("trainerId") UUID trainerId);

    boolean existsByTrainerId(UUID trainerId);
}
