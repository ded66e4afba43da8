package com.codegym.backend.services;

import java.time.LocalDateTime;
import java.util.Map;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.config.AsyncExecutorConfig;
import com.codegym.backend.entities.AuditEvent;
import com.codegym.backend.enums.AuditEventStatus;
import com.codegym.backend.repositories.AuditEventRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditEventRepository auditEventRepository;

    /**
     * Persists the event in its own transaction, off the request thread. A
     * failure here is logged and never reaches the audited operation.
     */
    @Async(AsyncExecutorConfig.NOTIFICATION_EXECUTOR)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logEvent(AuditEvent event) {
        try {
            auditEventRepository.save(event);
        } catch (RuntimeException e) {
            log.error("Failed to store audit event {} by {}", event.getAction(), event.getActor(), e);
        }
    }

    public AuditEvent createEvent(
            String actor,
            String ipAddress,
            String action,
            String entityId,
            String entityType,
            Map<String, Object> details,
            AuditEventStatus status
    ) {
        return AuditEvent.builder()
                .timestamp(LocalDateTime.now())
                .actor(actor)
                .ipAddress(ipAddress)
                .action(action)
                .entityId(entityId)
                .entityType(entityType == null || entityType.isBlank() ? null : entityType)
                .details(details)
                .status(status)
                .build();
    }

    @Transactional(readOnly = true)
    public Page<AuditEvent> search(
            String actor,
            String action,
            AuditEventStatus status,
            LocalDateTime start,
            LocalDateTime end,
            Pageable pageable
    ) {
        return auditEventRepository.search(blankToNull(actor), blankToNull(action), status, start, end, pageable);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
