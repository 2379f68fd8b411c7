package com.vanityhub.server.validation.schema;

import java.util.ArrayList;
import java.util.List;

public final class ArrayField extends FieldSchema<ArrayField> {

    private final FieldSchema<?> element;
    private Integer minItems;
    private Integer maxItems;

    public ArrayField(FieldSchema<?> element) {
        this.element = element;
    }

    public ArrayField minItems(int min) {
        this.minItems = min;
        return this;
    }

    public ArrayField maxItems(int max) {
        this.maxItems = max;
        return this;
    }

    @Override
    protected ArrayField self() {
        return this;
    }

    @Override
    public String typeName() {
        return "array";
    }

    @Override
    protected Object check(String path, Object value, List<String> errors) {
        if (!(value instanceof List<?> list)) {
            typeMismatch(errors, path, value);
            return ABSENT;
        }
        int before = errors.size();
        if (minItems != null && list.size() < minItems) {
            fail(errors, path, "Array must contain at least " + minItems + " element(s)");
        }
        if (maxItems != null && list.size() > maxItems) {
            fail(errors, path, "Array must contain at most " + maxItems + " element(s)");
        }
        List<Object> out = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            String itemPath = child(path, String.valueOf(i));
            if (item == null) {
                fail(errors, itemPath, "Expected " + element.typeName() + ", received null");
                continue;
            }
            Object v = element.validate(itemPath, item, errors);
            if (v != ABSENT) {
                out.add(v);
            }
        }
        return errors.size() == before ? out : ABSENT;
    }
}
