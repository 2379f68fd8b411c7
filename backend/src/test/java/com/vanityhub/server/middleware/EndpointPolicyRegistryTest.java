package com.vanityhub.server.middleware;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.vanityhub.server.config.EndpointPolicyProperties;
import com.vanityhub.server.model.Role;
import com.vanityhub.server.service.ratelimit.RateLimitPreset;
import com.vanityhub.server.validation.SchemaRegistry;

import static org.junit.jupiter.api.Assertions.*;

class EndpointPolicyRegistryTest {

    private static EndpointPolicyProperties.Endpoint endpoint(String pattern) {
        EndpointPolicyProperties.Endpoint e = new EndpointPolicyProperties.Endpoint();
        e.setPattern(pattern);
        return e;
    }

    @Test
    void shouldRegisterBuiltInAuditLogPolicy() {
        EndpointPolicyRegistry registry = new EndpointPolicyRegistry(new EndpointPolicyProperties(), new SchemaRegistry());

        EndpointPolicy policy = registry.resolve("GET", EndpointPolicyRegistry.AUDIT_LOGS_PATH).orElseThrow();

        assertTrue(policy.isRequireAuth());
        assertEquals(Set.of(Role.ADMIN), policy.getRoles());
        assertEquals(RateLimitPreset.MODERATE.rule(), policy.getRateLimit());
        assertEquals("VIEW_AUDIT_LOGS", policy.getAuditAction());
        assertTrue(registry.resolve("DELETE", EndpointPolicyRegistry.AUDIT_LOGS_PATH).isEmpty());
    }

    @Test
    void shouldResolveFirstMatchingPolicyFromConfiguration() {
        EndpointPolicyProperties.Endpoint login = endpoint("/api/auth/login");
        login.setMethods(List.of("post"));
        login.setRateLimit(RateLimitPreset.LOGIN);
        login.setSchema("userLogin");
        EndpointPolicyProperties.Endpoint staffArea = endpoint("/api/staff/**");
        staffArea.setRoles(List.of(Role.ADMIN, Role.STAFF));
        staffArea.setWindowMs(60_000L);
        staffArea.setMaxRequests(30);
        EndpointPolicyProperties properties = new EndpointPolicyProperties();
        properties.setEndpoints(List.of(login, staffArea));

        EndpointPolicyRegistry registry = new EndpointPolicyRegistry(properties, new SchemaRegistry());

        EndpointPolicy loginPolicy = registry.resolve("POST", "/api/auth/login").orElseThrow();
        assertEquals("userLogin", loginPolicy.getSchema());
        assertFalse(loginPolicy.isRequireAuth());
        assertTrue(registry.resolve("GET", "/api/auth/login").isEmpty());

        EndpointPolicy staffPolicy = registry.resolve("GET", "/api/staff/schedule/today").orElseThrow();
        assertTrue(staffPolicy.isRequireAuth());
        assertEquals(60_000L, staffPolicy.getRateLimit().windowMs());
        assertEquals(30, staffPolicy.getRateLimit().maxRequests());
        assertEquals(3, registry.getPolicies().size());
    }

    @Test
    void shouldLetConfigurationOverrideBuiltInPolicy() {
        EndpointPolicyProperties.Endpoint override = endpoint(EndpointPolicyRegistry.AUDIT_LOGS_PATH);
        override.setRoles(List.of(Role.ADMIN, Role.MANAGER));
        EndpointPolicyProperties properties = new EndpointPolicyProperties();
        properties.setEndpoints(List.of(override));

        EndpointPolicyRegistry registry = new EndpointPolicyRegistry(properties, new SchemaRegistry());

        assertEquals(Set.of(Role.ADMIN, Role.MANAGER),
                registry.resolve("GET", EndpointPolicyRegistry.AUDIT_LOGS_PATH).orElseThrow().getRoles());
    }

    @Test
    void shouldFailFastOnUnknownSchema() {
        EndpointPolicyRegistry registry = new EndpointPolicyRegistry(new EndpointPolicyProperties(), new SchemaRegistry());

        assertThrows(IllegalArgumentException.class,
                () -> registry.register(EndpointPolicy.builder("/api/x").schema("noSuchSchema").build()));
    }

    @Test
    void shouldFlagInconsistentRateLimitConfiguration() {
        EndpointPolicyProperties.Endpoint both = endpoint("/api/x");
        both.setRateLimit(RateLimitPreset.STRICT);
        both.setWindowMs(1_000L);
        both.setMaxRequests(1);
        EndpointPolicyProperties.Endpoint half = endpoint("/api/y");
        half.setWindowMs(1_000L);

        assertFalse(both.isRateLimitConsistent());
        assertFalse(half.isRateLimitConsistent());
        assertTrue(endpoint("/api/z").isRateLimitConsistent());
    }

    @Test
    void shouldMatchAnyMethodWhenNoneDeclared() {
        EndpointPolicy policy = EndpointPolicy.builder("/api/x").build();

        assertTrue(policy.appliesTo("PATCH"));
        assertTrue(EndpointPolicy.builder("/api/x").methods("GET").build().appliesTo("get"));
    }
}
