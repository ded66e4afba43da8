package com.codegym.backend.dto.audit;

import java.time.LocalDateTime;
import java.util.Map;

import com.codegym.backend.enums.AuditEventStatus;

import lombok.Data;

@Data
public class AuditEventResponseDTO {
    private String id;
    private LocalDateTime timestamp;
    private String actor;
    private String ipAddress;
    private String action;
    private String entityId;
    private String entityType;
    private AuditEventStatus status;
    private Map<String, Object> details;
}
