package com.codegym.backend.repositories;

import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.codegym.backend.entities.AuditEvent;
import com.codegym.backend.enums.AuditEventStatus;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    @Query("""
            SELECT a FROM AuditEvent a
            WHERE (:actor IS NULL OR a.actor = :actor)
            AND (:action IS NULL OR a.action = :action)
            AND (:status IS NULL OR a.status = :status)
            AND (cast(:start as timestamp) IS NULL OR a.timestamp >= :start)
            AND (cast(:end as timestamp) IS NULL OR a.timestamp <= :end)
            """)
    Page<AuditEvent> search(
            @Param("actor") String actor,
            @Param("action") String action,
            @Param("status") AuditEventStatus status,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            Pageable pageable
    );
}
