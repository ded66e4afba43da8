package com.codegym.backend.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.audit.Auditable;
import com.codegym.backend.dto.admin.AdminUserCreateRequestDTO;
import com.codegym.backend.dto.admin.AdminUserUpdateRequestDTO;
import com.codegym.backend.dto.admin.AdminUserUpdateResultDTO;
import com.codegym.backend.dto.auth.StaffUserResponseDTO;
import com.codegym.backend.entities.User;
import com.codegym.backend.exceptions.BadRequestException;
import com.codegym.backend.exceptions.ConflictException;
import com.codegym.backend.exceptions.ResourceNotFoundException;
import com.codegym.backend.mappers.UserMapper;
import com.codegym.backend.repositories.UserRepository;
import com.codegym.backend.repositories.WorkoutPlanRepository;
import com.codegym.backend.security.SecurityService;
import com.codegym.backend.services.util.EntityIds;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Staff account administration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    static final int MIN_PASSWORD_LENGTH = 6;
    static final String SHORT_PASSWORD_WARNING =
            "Password must be at least 6 characters; the password was not changed";

    private final UserRepository userRepository;
    private final WorkoutPlanRepository workoutPlanRepository;
    private final PasswordEncoder passwordEncoder;
    private final SecurityService securityService;

    @Transactional(readOnly = true)
    public List<StaffUserResponseDTO> listUsers() {
        return userRepository.findAllByOrderByRoleAscUsernameAsc().stream()
                .map(UserMapper::toResponseDTO)
                .toList();
    }

    public User findById(String id) {
        UUID uuid = EntityIds.parseExisting(id, "User");
        return userRepository.findById(uuid)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    @Auditable(action = "USER_CREATED", entityType = "User")
    @Transactional
    public StaffUserResponseDTO createUser(AdminUserCreateRequestDTO request) {
        String username = request.getUsername().trim();
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);

        if (userRepository.existsByUsername(username)) {
            throw new ConflictException("Username '" + username + "' is already taken");
        }
        if (userRepository.existsByEmail(email)) {
            throw new ConflictException("Email '" + email + "' is already in use");
        }

        User user = new User();
        user.setUsername(username);
        user.setEmail(email);
        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setRole(request.getRole());
        user.setActive(true);

        User saved = userRepository.save(user);
        log.info("Staff user {} created with role {}", saved.getUsername(), saved.getRole());
        return UserMapper.toResponseDTO(saved);
    }

    /**
     * Updates profile fields. A blank password keeps the current one; a
     * password that is too short is ignored and reported as a warning
     * instead of failing the whole update.
     */
    @Auditable(action = "USER_UPDATED", entityType = "User")
    @Transactional
    public AdminUserUpdateResultDTO updateUser(String id, AdminUserUpdateRequestDTO request) {
        User user = findById(id);
        String username = request.getUsername().trim();
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);

        if (userRepository.existsByUsernameAndIdNot(username, user.getId())) {
            throw new ConflictException("Username '" + username + "' is already taken");
        }
        if (userRepository.existsByEmailAndIdNot(email, user.getId())) {
            throw new ConflictException("Email '" + email + "' is already in use");
        }

        List<String> warnings = new ArrayList<>();
        String password = request.getPassword();
        if (password != null && !password.isBlank()) {
            if (password.length() < MIN_PASSWORD_LENGTH) {
                warnings.add(SHORT_PASSWORD_WARNING);
            } else {
                user.setPassword(passwordEncoder.encode(password));
            }
        }

        user.setUsername(username);
        user.setEmail(email);
        user.setRole(request.getRole());

        User saved = userRepository.save(user);
        return new AdminUserUpdateResultDTO(UserMapper.toResponseDTO(saved), warnings);
    }

    @Auditable(action = "USER_TOGGLED", entityType = "User")
    @Transactional
    public StaffUserResponseDTO toggleActive(String id) {
        User user = findById(id);
        if (securityService.isCurrentUser(user.getId())) {
            throw new BadRequestException("You cannot lock your own account");
        }
        user.setActive(!user.isActive());
        User saved = userRepository.save(user);
        log.info("Staff user {} is now {}", saved.getUsername(), saved.isActive() ? "active" : "locked");
        return UserMapper.toResponseDTO(saved);
    }

    @Auditable(action = "USER_DELETED", entityType = "User")
    @Transactional
    public void deleteUser(String id) {
        User user = findById(id);
        if (securityService.isCurrentUser(user.getId())) {
            throw new BadRequestException("You cannot delete your own account");
        }
        if (workoutPlanRepository.existsByTrainerId(user.getId())) {
            throw new ConflictException("User '" + user.getUsername() + "' has authored workout plans and cannot be deleted");
        }
        userRepository.delete(user);
        log.info("Staff user {} deleted", user.getUsername());
    }
}
