package com.vanityhub.server.validation.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Object with named fields and optional cross-field rules.
 *
 * <p>Keys not declared in the schema are dropped from the output.
 * Refinements always run, against declared field values (coerced when the
 * field passed, raw when it failed), so a cross-field error is reported
 * together with per-field errors.</p>
 */
public final class ObjectField extends FieldSchema<ObjectField> {

    private record Refinement(Predicate<Map<String, Object>> rule, String fieldPath, String message) {}

    private final Map<String, FieldSchema<?>> fields = new LinkedHashMap<>();
    private final List<Refinement> refinements = new ArrayList<>();

    public ObjectField field(String name, FieldSchema<?> schema) {
        fields.put(name, schema);
        return this;
    }

    /**
     * Add a rule over the whole object; a violation is reported at
     * {@code fieldPath} relative to this object.
     */
    public ObjectField refine(Predicate<Map<String, Object>> rule, String fieldPath, String message) {
        refinements.add(new Refinement(rule, fieldPath, message));
        return this;
    }

    @Override
    protected ObjectField self() {
        return this;
    }

    @Override
    public String typeName() {
        return "object";
    }

    @Override
    protected Object check(String path, Object value, List<String> errors) {
        if (!(value instanceof Map<?, ?> input)) {
            typeMismatch(errors, path, value);
            return ABSENT;
        }
        int before = errors.size();
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, Object> view = new LinkedHashMap<>();

        for (Map.Entry<String, FieldSchema<?>> e : fields.entrySet()) {
            String name = e.getKey();
            Object raw = input.get(name);
            Object v = e.getValue().validate(child(path, name), raw, errors);
            if (v != ABSENT) {
                out.put(name, v);
                view.put(name, v);
            } else if (raw != null) {
                view.put(name, raw);
            }
        }

        Map<String, Object> readOnlyView = Collections.unmodifiableMap(view);
        for (Refinement r : refinements) {
            boolean passed;
            try {
                passed = r.rule().test(readOnlyView);
            } catch (RuntimeException ex) {
                passed = false;
            }
            if (!passed) {
                fail(errors, child(path, r.fieldPath()), r.message());
            }
        }

        return errors.size() == before ? out : ABSENT;
    }
}
