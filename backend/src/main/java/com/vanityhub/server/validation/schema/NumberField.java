package com.vanityhub.server.validation.schema;

import java.math.BigDecimal;
import java.util.List;

/**
 * Numeric field. Strings are never coerced to numbers.
 */
public final class NumberField extends FieldSchema<NumberField> {

    private BigDecimal min;
    private BigDecimal max;
    private boolean integer;

    @Override
    protected NumberField self() {
        return this;
    }

    @Override
    public String typeName() {
        return "number";
    }

    public NumberField min(double min) {
        this.min = BigDecimal.valueOf(min);
        return this;
    }

    public NumberField max(double max) {
        this.max = BigDecimal.valueOf(max);
        return this;
    }

    public NumberField integer() {
        this.integer = true;
        return this;
    }

    @Override
    protected Object check(String path, Object value, List<String> errors) {
        if (!(value instanceof Number n)) {
            typeMismatch(errors, path, value);
            return ABSENT;
        }
        if (n instanceof Double d && (d.isNaN() || d.isInfinite())
                || n instanceof Float f && (f.isNaN() || f.isInfinite())) {
            fail(errors, path, "Expected number, received nan");
            return ABSENT;
        }
        BigDecimal decimal = new BigDecimal(n.toString());
        boolean ok = true;
        if (integer && decimal.stripTrailingZeros().scale() > 0) {
            fail(errors, path, "Expected integer, received float");
            ok = false;
        }
        if (min != null && decimal.compareTo(min) < 0) {
            fail(errors, path, "Number must be greater than or equal to " + format(min));
            ok = false;
        }
        if (max != null && decimal.compareTo(max) > 0) {
            fail(errors, path, "Number must be less than or equal to " + format(max));
            ok = false;
        }
        return ok ? n : ABSENT;
    }

    private static String format(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
