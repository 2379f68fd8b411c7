package com.vanityhub.server.security;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import jakarta.servlet.http.HttpServletResponse;

/**
 * Origin allow-list for cross-origin requests.
 *
 * A preflight from an origin outside the list is answered with the literal
 * {@code "null"} origin, which browsers treat as a refusal.
 */
public class CorsPolicy {

    public static final String ALLOWED_METHODS = "GET, POST, PUT, DELETE, OPTIONS";
    public static final String ALLOWED_HEADERS = "Content-Type, Authorization";
    public static final String MAX_AGE_SECONDS = "86400";

    private final Set<String> allowedOrigins;

    public CorsPolicy(Set<String> allowedOrigins) {
        this.allowedOrigins = Set.copyOf(allowedOrigins);
    }

    /** Parse a comma-separated origin list. */
    public static CorsPolicy fromList(String raw) {
        Set<String> origins = new LinkedHashSet<>();
        if (raw != null) {
            Arrays.stream(raw.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(origins::add);
        }
        return new CorsPolicy(origins);
    }

    public boolean isAllowed(String origin) {
        return origin != null && allowedOrigins.contains(origin);
    }

    public void applyPreflight(String origin, HttpServletResponse response) {
        response.setHeader("Access-Control-Allow-Origin", isAllowed(origin) ? origin : "null");
        response.setHeader("Access-Control-Allow-Methods", ALLOWED_METHODS);
        response.setHeader("Access-Control-Allow-Headers", ALLOWED_HEADERS);
        response.setHeader("Access-Control-Max-Age", MAX_AGE_SECONDS);
        response.addHeader("Vary", "Origin");
    }

    /** For non-preflight requests only allowed origins are echoed. */
    public void applyActual(String origin, HttpServletResponse response) {
        if (isAllowed(origin)) {
            response.setHeader("Access-Control-Allow-Origin", origin);
            response.addHeader("Vary", "Origin");
        }
    }

    public Set<String> getAllowedOrigins() {
        return allowedOrigins;
    }
}
