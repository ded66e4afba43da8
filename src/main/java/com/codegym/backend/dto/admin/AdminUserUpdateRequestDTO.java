package com.codegym.backend.dto.admin;

import com.codegym.backend.enums.Role;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Password is optional here. Blank keeps the current one.
 */
@Data
public class AdminUserUpdateRequestDTO {

    @NotBlank(message = "Username is required")
    @Size(max = 64)
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Email is invalid")
    private String email;

    private String password;

    @NotNull(message = "Role is required")
    private Role role;
}
