package com.vanityhub.server.validation.schema;

import java.util.List;
import java.util.Map;

/**
 * Node of a declarative payload schema. Concrete variants are
 * {@link StringField}, {@link NumberField}, {@link BooleanField},
 * {@link EnumField}, {@link ArrayField} and {@link ObjectField}.
 *
 * <p>Schemas are configured once when built and then only read, so a built
 * schema can be shared across threads.</p>
 *
 * @param <S> concrete type, for fluent configuration
 */
public abstract class FieldSchema<S extends FieldSchema<S>> {

    /** Marker returned when a value is missing or failed validation. */
    public static final Object ABSENT = new Object() {
        @Override
        public String toString() {
            return "ABSENT";
        }
    };

    static final String ROOT_LABEL = "body";

    private boolean optional;
    private boolean hasDefault;
    private Object defaultValue;

    protected abstract S self();

    /** Short type name used in error messages and type mismatch reporting. */
    public abstract String typeName();

    /**
     * Check a present value. Implementations append every violation and
     * return the coerced value, or {@link #ABSENT} when anything failed.
     */
    protected abstract Object check(String path, Object value, List<String> errors);

    public S optional() {
        this.optional = true;
        return self();
    }

    /** Value substituted when the field is missing. Implies optional. */
    public S defaultValue(Object value) {
        this.hasDefault = true;
        this.defaultValue = value;
        return self();
    }

    public boolean isOptional() {
        return optional || hasDefault;
    }

    /**
     * Validate {@code raw} at {@code path}.
     *
     * @return the typed value, or {@link #ABSENT}
     */
    public final Object validate(String path, Object raw, List<String> errors) {
        if (raw == null) {
            if (hasDefault) {
                return defaultValue;
            }
            if (!optional) {
                fail(errors, path, "Required");
            }
            return ABSENT;
        }
        return check(path, raw, errors);
    }

    // ==================== HELPERS ====================

    protected static void fail(List<String> errors, String path, String message) {
        errors.add((path == null || path.isEmpty() ? ROOT_LABEL : path) + ": " + message);
    }

    protected static String child(String path, String segment) {
        return path == null || path.isEmpty() ? segment : path + "." + segment;
    }

    protected static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }

    protected void typeMismatch(List<String> errors, String path, Object value) {
        fail(errors, path, "Expected " + typeName() + ", received " + describe(value));
    }
}
