package com.vanityhub.server.validation.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating a payload against a schema.
 * On success {@code data} holds the coerced value and {@code errors} is empty.
 */
public record ValidationResult(boolean success, Object data, List<String> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok(Object data) {
        return new ValidationResult(true, data, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, null, errors);
    }

    /** The coerced object as a string-keyed map, or an empty map for any other value. */
    public Map<String, Object> dataAsMap() {
        if (!(data instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
