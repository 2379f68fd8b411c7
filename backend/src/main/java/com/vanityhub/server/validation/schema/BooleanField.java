package com.vanityhub.server.validation.schema;

import java.util.List;

public final class BooleanField extends FieldSchema<BooleanField> {

    @Override
    protected BooleanField self() {
        return this;
    }

    @Override
    public String typeName() {
        return "boolean";
    }

    @Override
    protected Object check(String path, Object value, List<String> errors) {
        if (value instanceof Boolean) {
            return value;
        }
        typeMismatch(errors, path, value);
        return ABSENT;
    }
}
