package com.codegym.backend.services;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.dto.auth.AuthRequestDTO;
import com.codegym.backend.dto.auth.AuthResponseDTO;
import com.codegym.backend.dto.auth.StaffUserResponseDTO;
import com.codegym.backend.entities.User;
import com.codegym.backend.mappers.UserMapper;
import com.codegym.backend.repositories.UserRepository;
import com.codegym.backend.security.JwtService;
import com.codegym.backend.security.SecurityService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String INVALID_CREDENTIALS = "Invalid username or password";
    static final String ACCOUNT_LOCKED = "Your account is locked. Please contact an administrator.";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final SecurityService securityService;

    @Transactional(readOnly = true)
    public AuthResponseDTO login(AuthRequestDTO request) {
        User user = userRepository.findByUsername(request.getUsername().trim())
                .orElseThrow(() -> new BadCredentialsException(INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            log.info("Failed login for {}", user.getUsername());
            throw new BadCredentialsException(INVALID_CREDENTIALS);
        }

        // checked after the password so a lock does not reveal which usernames exist
        if (!user.isActive()) {
            log.info("Locked account {} tried to log in", user.getUsername());
            throw new DisabledException(ACCOUNT_LOCKED);
        }

        log.info("User {} logged in as {}", user.getUsername(), user.getRole());
        return AuthResponseDTO.builder()
                .token(jwtService.generateToken(user))
                .tokenType("Bearer")
                .expiresIn(jwtService.getExpirationMillis())
                .username(user.getUsername())
                .role(user.getRole())
                .landingPath(user.getRole().getLandingPath())
                .build();
    }

    @Transactional(readOnly = true)
    public StaffUserResponseDTO currentUser() {
        return UserMapper.toResponseDTO(securityService.getCurrentUser());
    }
}
