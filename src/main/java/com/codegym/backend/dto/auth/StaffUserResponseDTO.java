package com.codegym.backend.dto.auth;

import java.time.LocalDateTime;

import com.codegym.backend.enums.Role;

import lombok.Data;

@Data
public class StaffUserResponseDTO {
    private String id;
    private String username;
    private String email;
    private Role role;
    private boolean active;
    private LocalDateTime createdAt;
}
