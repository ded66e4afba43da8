package com.codegym.backend.controllers.admin;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.codegym.backend.dto.ApiResponse;
import com.codegym.backend.dto.dashboard.ActiveMembersDTO;
import com.codegym.backend.dto.dashboard.AdminDashboardSummaryDTO;
import com.codegym.backend.dto.dashboard.PackageMemberCountDTO;
import com.codegym.backend.dto.revenue.RevenueReportDTO;
import com.codegym.backend.services.AdminDashboardService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/admin/dashboard")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminDashboardController {

    private final AdminDashboardService dashboardService;

    @GetMapping
    public ResponseEntity<ApiResponse<AdminDashboardSummaryDTO>> summary() {
        return ResponseEntity.ok(ApiResponse.success(dashboardService.summary()));
    }

    @GetMapping("/revenue")
    public ResponseEntity<ApiResponse<RevenueReportDTO>> revenue() {
        return ResponseEntity.ok(ApiResponse.success(dashboardService.currentYearRevenue()));
    }

    @GetMapping("/active-members")
    public ResponseEntity<ApiResponse<ActiveMembersDTO>> activeMembers() {
        return ResponseEntity.ok(ApiResponse.success(dashboardService.activeMembers()));
    }

    @GetMapping("/members-per-package")
    public ResponseEntity<ApiResponse<List<PackageMemberCountDTO>>> membersPerPackage() {
        return ResponseEntity.ok(ApiResponse.success(dashboardService.membersPerPackage()));
    }
}
