package com.vanityhub.server.validation.schema;

import java.util.List;
import java.util.Objects;

import com.vanityhub.server.model.Role;

/**
 * Reusable field schemas and the composite request schemas built from them.
 *
 * <p>Primitive factories return a fresh instance per call so composites can
 * extend them (e.g. {@code email().optional()}) without affecting each other.</p>
 */
public final class CommonSchemas {

    private CommonSchemas() {
        // utility class
    }

    // ==================== PRIMITIVES ====================

    public static StringField password() {
        return new StringField()
                .minLength(8, "Password must be at least 8 characters")
                .maxLength(128, "Password must not exceed 128 characters")
                .pattern("[A-Z]", "Password must contain at least one uppercase letter")
                .pattern("[a-z]", "Password must contain at least one lowercase letter")
                .pattern("[0-9]", "Password must contain at least one number")
                .pattern("[^A-Za-z0-9]", "Password must contain at least one special character");
    }

    public static StringField email() {
        return new StringField()
                .email("Invalid email format")
                .maxLength(254, "Email must not exceed 254 characters")
                .lowercase()
                .trim();
    }

    public static StringField phone() {
        return new StringField()
                .pattern("^\\+?[1-9]\\d{1,14}$", "Invalid phone number format")
                .stripWhitespace();
    }

    public static StringField name() {
        return new StringField()
                .minLength(1, "Name is required")
                .maxLength(100, "Name must not exceed 100 characters")
                .pattern("^[a-zA-Z\\s'-]+$", "Name can only contain letters, spaces, hyphens, and apostrophes")
                .trim();
    }

    public static StringField address() {
        return new StringField()
                .maxLength(255, "Address must not exceed 255 characters")
                .trim();
    }

    private static StringField text(int max) {
        return new StringField().maxLength(max);
    }

    private static StringField uuid() {
        return new StringField().uuid();
    }

    private static NumberField nonNegative() {
        return new NumberField().min(0);
    }

    private static NumberField durationMinutes() {
        return new NumberField().min(15).max(480);
    }

    // ==================== COMPOSITES ====================

    public static ObjectField userRegistration() {
        return new ObjectField()
                .field("email", email())
                .field("password", password())
                .field("confirmPassword", new StringField())
                .refine(o -> Objects.equals(o.get("password"), o.get("confirmPassword")),
                        "confirmPassword", "Passwords don't match");
    }

    public static ObjectField userLogin() {
        return new ObjectField()
                .field("email", email())
                .field("password", new StringField().minLength(1, "Password is required"))
                .field("rememberMe", new BooleanField().defaultValue(false));
    }

    public static ObjectField userCreation() {
        return new ObjectField()
                .field("email", email())
                .field("name", name())
                .field("role", EnumField.of(Role.class))
                .field("password", password().optional())
                .field("locations", new ArrayField(uuid()).defaultValue(List.of()));
    }

    public static ObjectField clientCreation() {
        return new ObjectField()
                .field("firstName", name())
                .field("lastName", name())
                .field("email", email().optional())
                .field("phone", phone())
                .field("address", address().optional())
                .field("city", text(100).optional())
                .field("state", text(100).optional())
                .field("zipCode", text(20).optional())
                .field("country", text(100).optional())
                .field("dateOfBirth", new StringField().dateTime().optional())
                .field("notes", text(1000).optional())
                .field("preferredLocation", uuid().optional());
    }

    public static ObjectField appointmentCreation() {
        return new ObjectField()
                .field("clientId", uuid())
                .field("serviceId", uuid())
                .field("staffId", uuid())
                .field("locationId", uuid())
                .field("date", new StringField().dateTime())
                .field("duration", durationMinutes())
                .field("notes", text(500).optional())
                .field("price", nonNegative().optional());
    }

    public static ObjectField serviceCreation() {
        return new ObjectField()
                .field("name", new StringField().minLength(1).maxLength(100))
                .field("description", text(500).optional())
                .field("categoryId", uuid())
                .field("duration", durationMinutes())
                .field("price", nonNegative())
                .field("locations", new ArrayField(uuid()))
                .field("isActive", new BooleanField().defaultValue(true));
    }

    public static ObjectField productCreation() {
        return new ObjectField()
                .field("name", new StringField().minLength(1).maxLength(100))
                .field("description", text(500).optional())
                .field("categoryId", uuid())
                .field("brand", text(100).optional())
                .field("sku", text(50).optional())
                .field("price", nonNegative())
                .field("cost", nonNegative().optional())
                .field("stockQuantity", nonNegative().defaultValue(0))
                .field("minStockLevel", nonNegative().defaultValue(0))
                .field("isActive", new BooleanField().defaultValue(true));
    }

    public static ObjectField transactionCreation() {
        ObjectField item = new ObjectField()
                .field("type", new EnumField("SERVICE", "PRODUCT"))
                .field("id", uuid())
                .field("quantity", new NumberField().min(1))
                .field("price", nonNegative())
                .field("discount", new NumberField().min(0).max(100).optional());

        return new ObjectField()
                .field("clientId", uuid().optional())
                .field("locationId", uuid())
                .field("staffId", uuid())
                .field("items", new ArrayField(item))
                .field("paymentMethod", new EnumField("CASH", "CARD", "GIFT_CARD", "BANK_TRANSFER"))
                .field("subtotal", nonNegative())
                .field("tax", nonNegative())
                .field("discount", nonNegative())
                .field("total", nonNegative())
                .field("notes", text(500).optional());
    }
}
