package com.example.mnm.security;

import com.example.mnm.auth.UserRole;
import org.springframework.security.core.Authentication;

import java.util.Optional;

/**
 * Principal placed in the security context by {@link JwtAuthFilter}.
 */
public record AuthenticatedUser(String id, UserRole role) {

    public static Optional<AuthenticatedUser> from(Authentication authentication) {
        if (authentication == null) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return Optional.of(user);
        }
        return Optional.empty();
    }
}
