package com.codegym.backend.mappers;

import com.codegym.backend.dto.audit.AuditEventResponseDTO;
import com.codegym.backend.entities.AuditEvent;

public class AuditEventMapper {

    private AuditEventMapper() {
    }

    public static AuditEventResponseDTO toResponseDTO(AuditEvent e) {
        AuditEventResponseDTO dto = new AuditEventResponseDTO();
        dto.setId(e.getId().toString());
        dto.setTimestamp(e.getTimestamp());
        dto.setActor(e.getActor());
        dto.setIpAddress(e.getIpAddress());
        dto.setAction(e.getAction());
        dto.setEntityId(e.getEntityId());
        dto.setEntityType(e.getEntityType());
        dto.setStatus(e.getStatus());
        dto.setDetails(e.getDetails());
        return dto;
    }
}
