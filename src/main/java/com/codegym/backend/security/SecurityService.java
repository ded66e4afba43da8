package com.codegym.backend.security;

import java.util.Optional;
import java.util.UUID;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import com.codegym.backend.entities.User;
import com.codegym.backend.exceptions.ResourceNotFoundException;
import com.codegym.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

/**
 * Resolves the staff account behind the current request.
 */
@Component("securityService")
@RequiredArgsConstructor
public class SecurityService {

    private final UserRepository userRepository;

    public Optional<String> getCurrentUsername() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            return Optional.empty();
        }
        return Optional.ofNullable(auth.getName());
    }

    public User getCurrentUser() {
        String username = getCurrentUsername()
                .orElseThrow(() -> new IllegalStateException("No authenticated user in context"));
        return userRepository.findByUsername(username)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + username));
    }

    public boolean isCurrentUser(UUID userId) {
        return getCurrentUsername()
                .flatMap(userRepository::findByUsername)
                .map(user -> user.getId().equals(userId))
                .orElse(false);
    }
}
