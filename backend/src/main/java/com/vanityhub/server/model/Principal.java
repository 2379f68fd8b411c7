package com.vanityhub.server.model;

import java.util.Objects;
import java.util.Set;

/**
 * Identity resolved from a verified token for the lifetime of one request.
 * Never persisted.
 */
public record Principal(String id, String email, Role role, Set<String> authorizedLocations) {

    public Principal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        authorizedLocations = authorizedLocations == null ? Set.of() : Set.copyOf(authorizedLocations);
    }

    public boolean canAccessLocation(String locationId) {
        return role == Role.ADMIN || authorizedLocations.contains(locationId);
    }
}
