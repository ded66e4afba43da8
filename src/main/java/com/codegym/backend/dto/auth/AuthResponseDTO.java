package com.codegym.backend.dto.auth;

import com.codegym.backend.enums.Role;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponseDTO {
    private String token;
    private String tokenType;
    private Long expiresIn;
    private String username;
    private Role role;

    // dashboard the client should navigate to for this role
    private String landingPath;
}
