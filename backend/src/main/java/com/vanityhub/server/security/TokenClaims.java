package com.vanityhub.server.security;

import java.util.List;

/**
 * Claims extracted from a verified token. {@code role} is the raw claim value.
 */
public record TokenClaims(String subject, String email, String role, List<String> locations) {

    public TokenClaims {
        locations = locations == null ? List.of() : List.copyOf(locations);
    }
}
