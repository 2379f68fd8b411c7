package com.vanityhub.server.dto;

import java.util.List;

import com.vanityhub.server.model.PasswordStrength;

public record PasswordValidationResult(boolean valid,
                                       PasswordStrength strength,
                                       int score,
                                       List<String> errors,
                                       List<String> suggestions) {

    public PasswordValidationResult {
        errors = List.copyOf(errors);
        suggestions = List.copyOf(suggestions);
    }
}
