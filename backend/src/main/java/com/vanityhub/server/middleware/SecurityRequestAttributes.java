package com.vanityhub.server.middleware;

import java.util.Map;
import java.util.Optional;

import com.vanityhub.server.model.Principal;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Request attributes set by {@link SecurityMiddleware} for handlers.
 */
public final class SecurityRequestAttributes {

    public static final String PRINCIPAL = SecurityRequestAttributes.class.getName() + ".principal";
    public static final String VALIDATED_BODY = SecurityRequestAttributes.class.getName() + ".validatedBody";
    public static final String POLICY = SecurityRequestAttributes.class.getName() + ".policy";

    private SecurityRequestAttributes() {
    }

    public static Optional<Principal> principal(HttpServletRequest request) {
        return request.getAttribute(PRINCIPAL) instanceof Principal p ? Optional.of(p) : Optional.empty();
    }

    /** Sanitized, schema-validated body, or empty when the endpoint declares no schema. */
    public static Optional<Map<String, Object>> validatedBody(HttpServletRequest request) {
        return request.getAttribute(VALIDATED_BODY) instanceof ValidatedBody v
                ? Optional.of(v.data())
                : Optional.empty();
    }

    static void setValidatedBody(HttpServletRequest request, Map<String, Object> data) {
        request.setAttribute(VALIDATED_BODY, new ValidatedBody(data));
    }

    /** Typed holder for the validated body attribute. */
    record ValidatedBody(Map<String, Object> data) {
    }
}
