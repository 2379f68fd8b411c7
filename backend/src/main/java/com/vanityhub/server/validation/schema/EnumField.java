package com.vanityhub.server.validation.schema;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * String restricted to a fixed set of literals (case-sensitive).
 */
public final class EnumField extends FieldSchema<EnumField> {

    private final Set<String> values;

    public EnumField(String... values) {
        this.values = new LinkedHashSet<>(Arrays.asList(values));
    }

    public static <E extends Enum<E>> EnumField of(Class<E> type) {
        return new EnumField(Arrays.stream(type.getEnumConstants()).map(Enum::name).toArray(String[]::new));
    }

    @Override
    protected EnumField self() {
        return this;
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    protected Object check(String path, Object value, List<String> errors) {
        if (!(value instanceof String s)) {
            typeMismatch(errors, path, value);
            return ABSENT;
        }
        if (!values.contains(s)) {
            String expected = values.stream().map(v -> "'" + v + "'").collect(Collectors.joining(" | "));
            fail(errors, path, "Invalid enum value. Expected " + expected + ", received '" + s + "'");
            return ABSENT;
        }
        return s;
    }
}
