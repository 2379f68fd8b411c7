package com.vanityhub.server.validation;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.vanityhub.server.validation.schema.CommonSchemas;
import com.vanityhub.server.validation.schema.FieldSchema;

/**
 * Named request schemas that endpoint policies refer to by key.
 * Pre-populated with the built-in composites.
 */
@Component
public class SchemaRegistry {

    private final Map<String, FieldSchema<?>> schemas = new ConcurrentHashMap<>();

    public SchemaRegistry() {
        register("userRegistration", CommonSchemas.userRegistration());
        register("userLogin", CommonSchemas.userLogin());
        register("userCreation", CommonSchemas.userCreation());
        register("clientCreation", CommonSchemas.clientCreation());
        register("appointmentCreation", CommonSchemas.appointmentCreation());
        register("serviceCreation", CommonSchemas.serviceCreation());
        register("productCreation", CommonSchemas.productCreation());
        register("transactionCreation", CommonSchemas.transactionCreation());
    }

    public void register(String name, FieldSchema<?> schema) {
        if (name == null || name.isBlank() || schema == null) {
            throw new IllegalArgumentException("Schema name and schema are required");
        }
        schemas.put(name, schema);
    }

    public Optional<FieldSchema<?>> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(schemas.get(name));
    }

    public Set<String> names() {
        return Set.copyOf(schemas.keySet());
    }
}
