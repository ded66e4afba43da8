package com.codegym.backend.controllers.admin;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.codegym.backend.dto.ApiResponse;
import com.codegym.backend.dto.catalog.MembershipPackageRequestDTO;
import com.codegym.backend.dto.catalog.MembershipPackageResponseDTO;
import com.codegym.backend.services.MembershipPackageService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/admin/packages")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminPackageController {

    private final MembershipPackageService packageService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<MembershipPackageResponseDTO>>> list() {
        return ResponseEntity.ok(ApiResponse.success(packageService.listPackages()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<MembershipPackageResponseDTO>> create(
            @Valid @RequestBody MembershipPackageRequestDTO request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(packageService.create(request), "Package created"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<MembershipPackageResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody MembershipPackageRequestDTO request
    ) {
        return ResponseEntity.ok(ApiResponse.success(packageService.update(id, request), "Package updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        packageService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Package deleted"));
    }
}
