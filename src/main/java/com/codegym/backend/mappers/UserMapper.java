package com.codegym.backend.mappers;

import com.codegym.backend.dto.auth.StaffUserResponseDTO;
import com.codegym.backend.entities.User;

public class UserMapper {

    private UserMapper() {
    }

    // never exposes the password hash
    public static StaffUserResponseDTO toResponseDTO(User u) {
        if (u == null) return null;

        StaffUserResponseDTO dto = new StaffUserResponseDTO();
        dto.setId(u.getId() != null ? u.getId().toString() : null);
        dto.setUsername(u.getUsername());
        dto.setEmail(u.getEmail());
        dto.setRole(u.getRole());
        dto.setActive(u.isActive());
        dto.setCreatedAt(u.getCreatedAt());
        return dto;
    }
}
