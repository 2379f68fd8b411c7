package com.vanityhub.server.validation.schema;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * String field with length, pattern and format checks plus opt-in
 * coercions ({@link #trim()}, {@link #lowercase()}, {@link #stripWhitespace()})
 * applied after all checks pass.
 */
public final class StringField extends FieldSchema<StringField> {

    private static final Pattern EMAIL = Pattern.compile(
            "^[A-Za-z0-9.!#$%&'*+/=?^_`{|}~-]+@[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?"
                    + "(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)+$");
    private static final Pattern UUID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private record Check(Predicate<String> test, String message) {}

    private final List<Check> checks = new ArrayList<>();
    private final List<UnaryOperator<String>> coercions = new ArrayList<>();

    @Override
    protected StringField self() {
        return this;
    }

    @Override
    public String typeName() {
        return "string";
    }

    public StringField minLength(int min) {
        return minLength(min, "String must contain at least " + min + " character(s)");
    }

    public StringField minLength(int min, String message) {
        checks.add(new Check(s -> s.length() >= min, message));
        return this;
    }

    public StringField maxLength(int max) {
        return maxLength(max, "String must contain at most " + max + " character(s)");
    }

    public StringField maxLength(int max, String message) {
        checks.add(new Check(s -> s.length() <= max, message));
        return this;
    }

    /** Passes when the pattern is found; anchor it for a full match. */
    public StringField pattern(String regex, String message) {
        Pattern p = Pattern.compile(regex);
        checks.add(new Check(s -> p.matcher(s).find(), message));
        return this;
    }

    public StringField email(String message) {
        checks.add(new Check(s -> EMAIL.matcher(s).matches(), message));
        return this;
    }

    public StringField uuid() {
        checks.add(new Check(s -> UUID.matcher(s).matches(), "Invalid uuid"));
        return this;
    }

    /** ISO-8601 date-time with offset, e.g. {@code 2024-05-01T10:00:00Z}. */
    public StringField dateTime() {
        checks.add(new Check(StringField::isDateTime, "Invalid datetime"));
        return this;
    }

    public StringField trim() {
        coercions.add(String::strip);
        return this;
    }

    public StringField lowercase() {
        coercions.add(s -> s.toLowerCase(Locale.ROOT));
        return this;
    }

    public StringField stripWhitespace() {
        coercions.add(s -> WHITESPACE.matcher(s).replaceAll(""));
        return this;
    }

    @Override
    protected Object check(String path, Object value, List<String> errors) {
        if (!(value instanceof String s)) {
            typeMismatch(errors, path, value);
            return ABSENT;
        }
        boolean ok = true;
        for (Check c : checks) {
            if (!c.test().test(s)) {
                fail(errors, path, c.message());
                ok = false;
            }
        }
        if (!ok) {
            return ABSENT;
        }
        String out = s;
        for (UnaryOperator<String> coercion : coercions) {
            out = coercion.apply(out);
        }
        return out;
    }

    private static boolean isDateTime(String s) {
        try {
            OffsetDateTime.parse(s);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
