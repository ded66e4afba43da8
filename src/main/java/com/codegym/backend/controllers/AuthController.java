package com.codegym.backend.controllers;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.codegym.backend.dto.ApiResponse;
import com.codegym.backend.dto.auth.AuthRequestDTO;
import com.codegym.backend.dto.auth.AuthResponseDTO;
import com.codegym.backend.dto.auth.StaffUserResponseDTO;
import com.codegym.backend.dto.member.MemberRegistrationRequestDTO;
import com.codegym.backend.dto.member.MemberRegistrationResponseDTO;
import com.codegym.backend.services.AuthService;
import com.codegym.backend.services.MemberService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final MemberService memberService;

    @PostMapping("/login")
    public ResponseEntity<ApiResponse<AuthResponseDTO>> login(@Valid @RequestBody AuthRequestDTO request) {
        AuthResponseDTO response = authService.login(request);
        return ResponseEntity.ok(ApiResponse.success(response, "Login successful"));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<StaffUserResponseDTO>> me() {
        return ResponseEntity.ok(ApiResponse.success(authService.currentUser()));
    }

    // public self-registration, same rules as the reception desk
    @PostMapping("/register")
    public ResponseEntity<ApiResponse<MemberRegistrationResponseDTO>> register(
            @RequestBody MemberRegistrationRequestDTO request
    ) {
        MemberRegistrationResponseDTO response = memberService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(response, "Registration successful. A confirmation email is on its way."));
    }
}
