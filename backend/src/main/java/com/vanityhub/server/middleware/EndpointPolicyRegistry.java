package com.vanityhub.server.middleware;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;

import com.vanityhub.server.config.EndpointPolicyProperties;
import com.vanityhub.server.service.ratelimit.RateLimitPreset;
import com.vanityhub.server.validation.SchemaRegistry;

/**
 * Ordered endpoint policies. The first policy whose Ant-style pattern and
 * method set match the request wins; a request no policy matches passes
 * through with hardening headers only.
 *
 * Configured policies come first, then the built-in ones, so configuration
 * can override a built-in policy for the same path.
 */
@Component
public class EndpointPolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(EndpointPolicyRegistry.class);

    public static final String AUDIT_LOGS_PATH = "/api/admin/audit-logs";

    private final AntPathMatcher matcher = new AntPathMatcher();
    private final List<EndpointPolicy> policies = new CopyOnWriteArrayList<>();
    private final SchemaRegistry schemas;

    public EndpointPolicyRegistry(EndpointPolicyProperties properties, SchemaRegistry schemas) {
        this.schemas = schemas;
        properties.getEndpoints().forEach(e -> register(e.toPolicy()));

        register(EndpointPolicy.admin(AUDIT_LOGS_PATH)
                .methods("GET")
                .rateLimit(RateLimitPreset.MODERATE)
                .auditAction("VIEW_AUDIT_LOGS")
                .build());

        log.info("[Security] {} endpoint policies registered", policies.size());
    }

    /**
     * Append a policy. Fails fast when it names an unknown schema.
     */
    public void register(EndpointPolicy policy) {
        if (policy.getSchema() != null && schemas.find(policy.getSchema()).isEmpty()) {
            throw new IllegalArgumentException("Endpoint policy " + policy.getPattern()
                    + " refers to unknown schema '" + policy.getSchema() + "'");
        }
        policies.add(policy);
        log.debug("[Security] Registered {}", policy);
    }

    public Optional<EndpointPolicy> resolve(String method, String path) {
        if (path == null) {
            return Optional.empty();
        }
        for (EndpointPolicy policy : policies) {
            if (policy.appliesTo(method) && matcher.match(policy.getPattern(), path)) {
                return Optional.of(policy);
            }
        }
        return Optional.empty();
    }

    public List<EndpointPolicy> getPolicies() {
        return List.copyOf(policies);
    }
}
