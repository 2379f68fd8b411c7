package com.vanityhub.server.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.vanityhub.server.middleware.EndpointPolicy;
import com.vanityhub.server.model.Role;
import com.vanityhub.server.service.ratelimit.RateLimitPreset;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Endpoint policies declared in configuration:
 *
 * <pre>
 * vanityhub.security.endpoints[0].pattern=/api/auth/login
 * vanityhub.security.endpoints[0].methods=POST
 * vanityhub.security.endpoints[0].rate-limit=LOGIN
 * vanityhub.security.endpoints[0].schema=userLogin
 * </pre>
 */
@Validated
@ConfigurationProperties("vanityhub.security")
public class EndpointPolicyProperties {

    @Valid
    private List<Endpoint> endpoints = new ArrayList<>();

    public List<Endpoint> getEndpoints() { return endpoints; }
    public void setEndpoints(List<Endpoint> endpoints) { this.endpoints = endpoints; }

    public static class Endpoint {

        @NotBlank
        private String pattern;
        private List<String> methods = new ArrayList<>();
        private boolean requireAuth;
        private List<Role> roles = new ArrayList<>();
        private RateLimitPreset rateLimit;
        @Positive
        private Long windowMs;
        @Positive
        private Integer maxRequests;
        private String schema;
        private String auditAction;

        @AssertTrue(message = "use either rate-limit or window-ms/max-requests, and set both window-ms and max-requests")
        public boolean isRateLimitConsistent() {
            boolean custom = windowMs != null || maxRequests != null;
            if (custom && rateLimit != null) {
                return false;
            }
            return !custom || (windowMs != null && maxRequests != null);
        }

        public EndpointPolicy toPolicy() {
            EndpointPolicy.Builder b = EndpointPolicy.builder(pattern)
                    .methods(methods.toArray(String[]::new))
                    .requireAuth(requireAuth)
                    .roles(roles.toArray(Role[]::new))
                    .schema(schema)
                    .auditAction(auditAction);
            if (rateLimit != null) {
                b.rateLimit(rateLimit);
            } else if (windowMs != null && maxRequests != null) {
                b.rateLimit(windowMs, maxRequests);
            }
            return b.build();
        }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
        public List<String> getMethods() { return methods; }
        public void setMethods(List<String> methods) { this.methods = methods; }
        public boolean isRequireAuth() { return requireAuth; }
        public void setRequireAuth(boolean requireAuth) { this.requireAuth = requireAuth; }
        public List<Role> getRoles() { return roles; }
        public void setRoles(List<Role> roles) { this.roles = roles; }
        public RateLimitPreset getRateLimit() { return rateLimit; }
        public void setRateLimit(RateLimitPreset rateLimit) { this.rateLimit = rateLimit; }
        public Long getWindowMs() { return windowMs; }
        public void setWindowMs(Long windowMs) { this.windowMs = windowMs; }
        public Integer getMaxRequests() { return maxRequests; }
        public void setMaxRequests(Integer maxRequests) { this.maxRequests = maxRequests; }
        public String getSchema() { return schema; }
        public void setSchema(String schema) { this.schema = schema; }
        public String getAuditAction() { return auditAction; }
        public void setAuditAction(String auditAction) { this.auditAction = auditAction; }
    }
}
