package com.vanityhub.server.exception;

import java.util.List;

/**
 * Thrown when a password is hashed without meeting the password policy.
 */
public class WeakPasswordException extends RuntimeException {
    private final List<String> violations;

    public WeakPasswordException(List<String> violations) {
        super("Password does not meet requirements: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
