package com.vanityhub.server.middleware;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Hardening headers written on every response the security pipeline sees,
 * rejections and preflights included.
 *
 * Always:
 *   - X-Content-Type-Options: nosniff
 *   - X-Frame-Options: DENY
 *   - X-XSS-Protection: 1; mode=block
 * Additionally:
 *   - Strict-Transport-Security on HTTPS (configurable)
 *   - Cache-Control: no-store for /api/ responses
 *   - Referrer-Policy
 */
@Component
public class SecurityHeaders {

    @Value("${vanityhub.security.hsts.enabled:true}")
    private boolean hstsEnabled = true;

    @Value("${vanityhub.security.hsts.max-age:31536000}")
    private long hstsMaxAge = 31536000;

    public void apply(HttpServletRequest request, HttpServletResponse response) {
        response.setHeader("X-Content-Type-Options", "nosniff");
        response.setHeader("X-Frame-Options", "DENY");
        response.setHeader("X-XSS-Protection", "1; mode=block");

        if (hstsEnabled && "https".equalsIgnoreCase(request.getScheme())) {
            response.setHeader("Strict-Transport-Security",
                    "max-age=" + hstsMaxAge + "; includeSubDomains");
        }

        String path = request.getRequestURI();
        if (path != null && path.startsWith("/api/")) {
            response.setHeader("Cache-Control", "no-store, no-cache, must-revalidate");
            response.setHeader("Pragma", "no-cache");
        }

        response.setHeader("Referrer-Policy", "strict-origin-when-cross-origin");
    }
}
