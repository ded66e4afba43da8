package com.codegym.backend.controllers.admin;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.codegym.backend.dto.ApiResponse;
import com.codegym.backend.dto.settings.SystemSettingsDTO;
import com.codegym.backend.services.SystemConfigService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/admin/settings")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminSettingsController {

    private final SystemConfigService systemConfigService;

    @GetMapping
    public ResponseEntity<ApiResponse<SystemSettingsDTO>> get() {
        return ResponseEntity.ok(ApiResponse.success(systemConfigService.getSettings()));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<SystemSettingsDTO>> update(@Valid @RequestBody SystemSettingsDTO request) {
        SystemSettingsDTO saved = systemConfigService.updateMaxTrainingDays(request.getMaxTrainingDays());
        return ResponseEntity.ok(ApiResponse.success(saved, "Settings saved"));
    }
}
