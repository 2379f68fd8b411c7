package com.vanityhub.server.security;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.vanityhub.server.model.Principal;
import com.vanityhub.server.model.Role;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizerTest {

    private final Authorizer authorizer = new Authorizer();
    private final Principal staff = new Principal("u-1", "s@salon.example", Role.STAFF, Set.of("loc-1"));

    @Test
    void shouldAdmitAnyPrincipalWhenNoRolesRequired() {
        assertTrue(authorizer.authorize(staff, Set.of()));
        assertTrue(authorizer.authorize(staff, null));
    }

    @Test
    void shouldRequireMembershipInRoleSet() {
        assertTrue(authorizer.authorize(staff, Set.of(Role.ADMIN, Role.STAFF)));
        assertFalse(authorizer.authorize(staff, Set.of(Role.ADMIN)));
    }

    @Test
    void shouldDenyMissingPrincipalWhenRolesRequired() {
        assertFalse(authorizer.authorize(null, Set.of(Role.CLIENT)));
    }

    @Test
    void shouldLetAdminAccessAnyLocation() {
        Principal admin = new Principal("u-2", null, Role.ADMIN, Set.of());

        assertTrue(admin.canAccessLocation("loc-9"));
        assertTrue(staff.canAccessLocation("loc-1"));
        assertFalse(staff.canAccessLocation("loc-9"));
    }
}
