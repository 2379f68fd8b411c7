package com.vanityhub.server.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Roles a {@link Principal} can carry. Claim values are matched case-insensitively.
 */
public enum Role {
    ADMIN,
    MANAGER,
    STAFF,
    RECEPTIONIST,
    CLIENT;

    public static Optional<Role> fromClaim(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Role.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
