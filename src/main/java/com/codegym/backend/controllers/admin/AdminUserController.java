package com.codegym.backend.controllers.admin;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.codegym.backend.dto.ApiResponse;
import com.codegym.backend.dto.admin.AdminUserCreateRequestDTO;
import com.codegym.backend.dto.admin.AdminUserUpdateRequestDTO;
import com.codegym.backend.dto.admin.AdminUserUpdateResultDTO;
import com.codegym.backend.dto.auth.StaffUserResponseDTO;
import com.codegym.backend.services.UserService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminUserController {

    private final UserService userService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<StaffUserResponseDTO>>> list() {
        return ResponseEntity.ok(ApiResponse.success(userService.listUsers()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<StaffUserResponseDTO>> create(@Valid @RequestBody AdminUserCreateRequestDTO request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(userService.createUser(request), "User created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<AdminUserUpdateResultDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody AdminUserUpdateRequestDTO request
    ) {
        AdminUserUpdateResultDTO result = userService.updateUser(id, request);
        String message = result.getWarnings().isEmpty()
                ? "User updated"
                : "User updated. " + String.join(". ", result.getWarnings());
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }

    @PatchMapping("/{id}/toggle-active")
    public ResponseEntity<ApiResponse<StaffUserResponseDTO>> toggleActive(@PathVariable String id) {
        StaffUserResponseDTO user = userService.toggleActive(id);
        return ResponseEntity.ok(ApiResponse.success(user, user.isActive() ? "User unlocked" : "User locked"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        userService.deleteUser(id);
        return ResponseEntity.ok(ApiResponse.success(null, "User deleted"));
    }
}
