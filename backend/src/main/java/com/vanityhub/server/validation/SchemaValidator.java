package com.vanityhub.server.validation;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.vanityhub.server.validation.schema.FieldSchema;
import com.vanityhub.server.validation.schema.ValidationResult;

/**
 * Validates request payloads against a declarative schema.
 *
 * <p>Every string leaf is sanitized before any rule is evaluated, so checks
 * see the same value the handler will receive. All violations are collected;
 * validation never stops at the first one.</p>
 */
@Component
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    static final String INVALID_INPUT_FORMAT = "Invalid input format";

    private final SanitizationEngine sanitizer;

    public SchemaValidator(SanitizationEngine sanitizer) {
        this.sanitizer = sanitizer;
    }

    public ValidationResult validate(FieldSchema<?> schema, Object rawInput) {
        try {
            Object sanitized = sanitizer.sanitizeObject(rawInput);
            List<String> errors = new ArrayList<>();
            Object data = schema.validate("", sanitized, errors);
            if (!errors.isEmpty()) {
                return ValidationResult.fail(errors);
            }
            return ValidationResult.ok(data == FieldSchema.ABSENT ? null : data);
        } catch (RuntimeException e) {
            log.warn("[Validation] Unexpected failure while validating payload: {}", e.toString());
            return ValidationResult.fail(List.of(INVALID_INPUT_FORMAT));
        }
    }
}
