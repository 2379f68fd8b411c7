package com.vanityhub.server.middleware;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import com.vanityhub.server.model.Role;
import com.vanityhub.server.service.ratelimit.RateLimitPreset;
import com.vanityhub.server.service.ratelimit.RateLimitRule;

/**
 * What the security pipeline enforces for one group of endpoints.
 *
 * <pre>
 *   EndpointPolicy.admin("/api/users/**")
 *           .methods("POST")
 *           .rateLimit(RateLimitPreset.STRICT)
 *           .schema("userCreation")
 *           .auditAction("CREATE_USER")
 *           .build();
 * </pre>
 *
 * Declaring roles implies {@code requireAuth}. An empty method set matches every method.
 */
public final class EndpointPolicy {

    private final String pattern;
    private final Set<String> methods;
    private final boolean requireAuth;
    private final Set<Role> roles;
    private final RateLimitRule rateLimit;
    private final String schema;
    private final String auditAction;

    private EndpointPolicy(Builder b) {
        this.pattern = b.pattern;
        this.methods = Set.copyOf(b.methods);
        this.roles = b.roles.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(b.roles));
        this.requireAuth = b.requireAuth || !b.roles.isEmpty();
        this.rateLimit = b.rateLimit;
        this.schema = b.schema;
        this.auditAction = b.auditAction;
    }

    public static Builder builder(String pattern) {
        return new Builder(pattern);
    }

    public static Builder authenticated(String pattern) {
        return new Builder(pattern).requireAuth(true);
    }

    public static Builder admin(String pattern) {
        return authenticated(pattern).roles(Role.ADMIN);
    }

    public static Builder staff(String pattern) {
        return authenticated(pattern).roles(Role.ADMIN, Role.STAFF);
    }

    public boolean appliesTo(String method) {
        return methods.isEmpty() || (method != null && methods.contains(method.toUpperCase(Locale.ROOT)));
    }

    public String getPattern()        { return pattern; }
    public Set<String> getMethods()   { return methods; }
    public boolean isRequireAuth()    { return requireAuth; }
    public Set<Role> getRoles()       { return roles; }
    public RateLimitRule getRateLimit() { return rateLimit; }
    public String getSchema()         { return schema; }
    public String getAuditAction()    { return auditAction; }

    @Override
    public String toString() {
        return "EndpointPolicy{" + (methods.isEmpty() ? "*" : String.join(",", methods)) + " " + pattern
                + ", auth=" + requireAuth + ", roles=" + roles + ", rateLimit=" + rateLimit
                + ", schema=" + schema + "}";
    }

    // ==================== BUILDER ====================

    public static final class Builder {
        private final String pattern;
        private final Set<String> methods = new LinkedHashSet<>();
        private boolean requireAuth;
        private final Set<Role> roles = new LinkedHashSet<>();
        private RateLimitRule rateLimit;
        private String schema;
        private String auditAction;

        private Builder(String pattern) {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("Endpoint pattern is required");
            }
            this.pattern = pattern.trim();
        }

        public Builder methods(String... methods) {
            Arrays.stream(methods)
                    .map(m -> m.trim().toUpperCase(Locale.ROOT))
                    .filter(m -> !m.isEmpty())
                    .forEach(this.methods::add);
            return this;
        }

        public Builder requireAuth(boolean requireAuth) {
            this.requireAuth = requireAuth;
            return this;
        }

        public Builder roles(Role... roles) {
            this.roles.addAll(Arrays.asList(roles));
            return this;
        }

        public Builder rateLimit(RateLimitPreset preset) {
            this.rateLimit = preset.rule();
            return this;
        }

        public Builder rateLimit(long windowMs, int maxRequests) {
            this.rateLimit = new RateLimitRule(windowMs, maxRequests);
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder auditAction(String auditAction) {
            this.auditAction = auditAction;
            return this;
        }

        public EndpointPolicy build() {
            return new EndpointPolicy(this);
        }
    }
}
