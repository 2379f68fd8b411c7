package com.vanityhub.server.security;

import java.util.Set;

import org.springframework.stereotype.Component;

import com.vanityhub.server.model.Principal;
import com.vanityhub.server.model.Role;

/** Role check. An empty requirement admits any authenticated principal. */
@Component
public class Authorizer {

    public boolean authorize(Principal principal, Set<Role> requiredRoles) {
        if (requiredRoles == null || requiredRoles.isEmpty()) {
            return true;
        }
        return principal != null && requiredRoles.contains(principal.role());
    }
}
