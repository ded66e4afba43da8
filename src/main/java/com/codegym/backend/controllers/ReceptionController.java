package com.codegym.backend.controllers;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.codegym.backend.dto.ApiResponse;
import com.codegym.backend.dto.catalog.MembershipPackageResponseDTO;
import com.codegym.backend.dto.member.MemberRegistrationRequestDTO;
import com.codegym.backend.dto.member.MemberRegistrationResponseDTO;
import com.codegym.backend.dto.member.MemberResponseDTO;
import com.codegym.backend.services.MemberService;
import com.codegym.backend.services.MembershipPackageService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/reception")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('RECEPTIONIST', 'ADMIN')")
public class ReceptionController {

    private final MemberService memberService;
    private final MembershipPackageService packageService;

    @GetMapping("/members")
    public ResponseEntity<ApiResponse<List<MemberResponseDTO>>> listMembers() {
        return ResponseEntity.ok(ApiResponse.success(memberService.listMembers()));
    }

    @PostMapping("/members")
    public ResponseEntity<ApiResponse<MemberRegistrationResponseDTO>> registerMember(
            @RequestBody MemberRegistrationRequestDTO request
    ) {
        MemberRegistrationResponseDTO response = memberService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(response, "Member registered successfully"));
    }

    // packages offered on the registration form
    @GetMapping("/packages")
    public ResponseEntity<ApiResponse<List<MembershipPackageResponseDTO>>> listPackages() {
        return ResponseEntity.ok(ApiResponse.success(packageService.listPackages()));
    }
}
