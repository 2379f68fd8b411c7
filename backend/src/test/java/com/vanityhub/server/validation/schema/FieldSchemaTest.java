package com.vanityhub.server.validation.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldSchemaTest {

    private final List<String> errors = new ArrayList<>();

    // ===== Strings =====

    @Test
    void shouldReportAllFailingPasswordRules() {
        Object result = CommonSchemas.password().validate("password", "abc", errors);

        assertSame(FieldSchema.ABSENT, result);
        assertEquals(List.of(
                "password: Password must be at least 8 characters",
                "password: Password must contain at least one uppercase letter",
                "password: Password must contain at least one number",
                "password: Password must contain at least one special character"), errors);
    }

    @Test
    void shouldApplyCoercionsOnlyAfterChecksPass() {
        assertEquals("+15551234567", CommonSchemas.phone().validate("phone", "+15551234567", errors));
        assertTrue(errors.isEmpty());

        assertSame(FieldSchema.ABSENT, CommonSchemas.phone().validate("phone", "0123", errors));
        assertEquals(List.of("phone: Invalid phone number format"), errors);
    }

    @Test
    void shouldUseDefaultLengthMessages() {
        new StringField().minLength(2).maxLength(3).validate("code", "x", errors);
        new StringField().maxLength(3).validate("code", "xxxx", errors);

        assertEquals(List.of(
                "code: String must contain at least 2 character(s)",
                "code: String must contain at most 3 character(s)"), errors);
    }

    @Test
    void shouldValidateUuidAndDateTimeFormats() {
        new StringField().uuid().validate("id", "123", errors);
        new StringField().dateTime().validate("date", "tomorrow", errors);
        Object date = new StringField().dateTime().validate("date", "2024-05-01T10:00:00Z", errors);

        assertEquals("2024-05-01T10:00:00Z", date);
        assertEquals(List.of("id: Invalid uuid", "date: Invalid datetime"), errors);
    }

    @Test
    void shouldReportTypeMismatch() {
        new StringField().validate("name", 42, errors);

        assertEquals(List.of("name: Expected string, received number"), errors);
    }

    // ===== Numbers / booleans / enums =====

    @Test
    void shouldCheckNumberBounds() {
        NumberField duration = new NumberField().min(15).max(480);

        duration.validate("duration", 10, errors);
        duration.validate("duration", 500.5, errors);
        assertEquals(60, duration.validate("duration", 60, errors));

        assertEquals(List.of(
                "duration: Number must be greater than or equal to 15",
                "duration: Number must be less than or equal to 480"), errors);
    }

    @Test
    void shouldRejectFractionForIntegerField() {
        new NumberField().integer().validate("qty", 1.5, errors);
        assertEquals(2.0, new NumberField().integer().validate("qty", 2.0, errors));

        assertEquals(List.of("qty: Expected integer, received float"), errors);
    }

    @Test
    void shouldNotCoerceStringsToNumbersOrBooleans() {
        new NumberField().validate("price", "10", errors);
        new BooleanField().validate("flag", "true", errors);

        assertEquals(List.of(
                "price: Expected number, received string",
                "flag: Expected boolean, received string"), errors);
    }

    @Test
    void shouldListAllowedEnumValues() {
        new EnumField("CASH", "CARD").validate("paymentMethod", "cash", errors);

        assertEquals(List.of("paymentMethod: Invalid enum value. Expected 'CASH' | 'CARD', received 'cash'"), errors);
    }

    // ===== Arrays / objects =====

    @Test
    void shouldReportNullArrayElementWithElementType() {
        new ArrayField(new StringField()).validate("tags", Arrays.asList("a", null), errors);

        assertEquals(List.of("tags.1: Expected string, received null"), errors);
    }

    @Test
    void shouldEnforceArraySizeLimits() {
        new ArrayField(new StringField()).minItems(1).validate("tags", List.of(), errors);
        new ArrayField(new StringField()).maxItems(1).validate("tags", List.of("a", "b"), errors);

        assertEquals(List.of(
                "tags: Array must contain at least 1 element(s)",
                "tags: Array must contain at most 1 element(s)"), errors);
    }

    @Test
    void shouldFillDefaultsAndSkipMissingOptionals() {
        Object result = CommonSchemas.productCreation().validate("", Map.of(
                "name", "Shampoo",
                "categoryId", "11111111-1111-1111-1111-111111111111",
                "price", 12.5), errors);

        assertTrue(errors.isEmpty(), () -> errors.toString());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result;
        assertEquals(0, data.get("stockQuantity"));
        assertEquals(0, data.get("minStockLevel"));
        assertEquals(true, data.get("isActive"));
        assertFalse(data.containsKey("description"));
    }

    @Test
    void shouldPrefixNestedObjectPaths() {
        ObjectField schema = new ObjectField()
                .field("owner", new ObjectField().field("email", CommonSchemas.email()));

        schema.validate("", Map.of("owner", Map.of("email", "nope")), errors);

        assertEquals(List.of("owner.email: Invalid email format"), errors);
    }

    @Test
    void shouldAcceptKnownRoleOnly() {
        Map<String, Object> user = Map.of(
                "email", "staff@salon.example",
                "name", "Ana Maria",
                "role", "SUPERUSER");

        CommonSchemas.userCreation().validate("", user, errors);

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("role: Invalid enum value. Expected 'ADMIN'"));
    }
}
