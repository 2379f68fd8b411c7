package com.vanityhub.server.middleware;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;
import org.springframework.web.util.UrlPathHelper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vanityhub.server.exception.PayloadTooLargeException;
import com.vanityhub.server.model.AuditAction;
import com.vanityhub.server.model.AuditLogEntry;
import com.vanityhub.server.model.AuditSeverity;
import com.vanityhub.server.model.Principal;
import com.vanityhub.server.security.AuthenticationResult;
import com.vanityhub.server.security.Authenticator;
import com.vanityhub.server.security.Authorizer;
import com.vanityhub.server.security.CorsPolicy;
import com.vanityhub.server.service.SecurityMetricsService;
import com.vanityhub.server.service.audit.AuditLogger;
import com.vanityhub.server.service.audit.ClientInfoResolver;
import com.vanityhub.server.service.ratelimit.RateLimitDecision;
import com.vanityhub.server.service.ratelimit.RateLimitKey;
import com.vanityhub.server.service.ratelimit.RateLimiter;
import com.vanityhub.server.util.SecurityLogger;
import com.vanityhub.server.validation.SchemaRegistry;
import com.vanityhub.server.validation.SchemaValidator;
import com.vanityhub.server.validation.schema.FieldSchema;
import com.vanityhub.server.validation.schema.ValidationResult;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Security pipeline in front of every endpoint.
 *
 * <h3>Lifecycle</h3>
 * <pre>
 *   hardening headers (every response)
 *   OPTIONS            → 200 + CORS headers, stop
 *   ambiguous path     → 400 (path parameters, encoded separators, dot segments)
 *   no policy          → handler
 *   RATE_LIMIT_CHECK   → 429 + audit RATE_LIMIT_EXCEEDED
 *   AUTH_CHECK         → 401 + audit UNAUTHORIZED_ACCESS_ATTEMPT
 *   ROLE_CHECK         → 403 + audit UNAUTHORIZED_ACCESS_ATTEMPT
 *   VALIDATE_BODY      → 413 over the body limit, 400 (non-GET with a schema)
 *   HANDLER_INVOKE     → handler; an exception becomes an opaque 500
 * </pre>
 *
 * Policies are matched against the decoded path within the application, the
 * same path Spring MVC dispatches on. Requests whose raw path could decode to
 * a different route than the one matched are refused before any policy lookup.
 *
 * The handler sees the principal and validated body through
 * {@link SecurityRequestAttributes}. Only a validated request is buffered; its
 * body can be read again by the handler.
 */
@Component
@Order(1)
public class SecurityMiddleware implements Filter {

    private static final Logger log = LoggerFactory.getLogger(SecurityMiddleware.class);

    static final String ERROR_RATE_LIMITED = "Rate limit exceeded";
    static final String ERROR_UNAUTHENTICATED = "Authentication required";
    static final String ERROR_FORBIDDEN = "Insufficient permissions";
    static final String ERROR_INVALID_INPUT = "Invalid input";
    static final String ERROR_INVALID_JSON = "Invalid JSON payload";
    static final String ERROR_INTERNAL = "Internal server error";
    static final String ERROR_INVALID_PATH = "Invalid request path";
    static final String ERROR_PAYLOAD_TOO_LARGE = "Payload too large";

    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    static {
        PATH_HELPER.setUrlDecode(true);
        PATH_HELPER.setRemoveSemicolonContent(true);
    }

    private final SecurityHeaders securityHeaders;
    private final CorsPolicy corsPolicy;
    private final EndpointPolicyRegistry policies;
    private final RateLimiter rateLimiter;
    private final Authenticator authenticator;
    private final Authorizer authorizer;
    private final SchemaRegistry schemas;
    private final SchemaValidator validator;
    private final AuditLogger auditLogger;
    private final ClientInfoResolver clientInfo;
    private final SecurityMetricsService metrics;
    private final ObjectMapper objectMapper;

    @Value("${vanityhub.audit.log-validation-failures:false}")
    private boolean auditValidationFailures;

    @Value("${vanityhub.security.max-body-bytes:1048576}")
    private int maxBodyBytes = 1_048_576;

    public SecurityMiddleware(SecurityHeaders securityHeaders,
                              CorsPolicy corsPolicy,
                              EndpointPolicyRegistry policies,
                              RateLimiter rateLimiter,
                              Authenticator authenticator,
                              Authorizer authorizer,
                              SchemaRegistry schemas,
                              SchemaValidator validator,
                              AuditLogger auditLogger,
                              ClientInfoResolver clientInfo,
                              SecurityMetricsService metrics,
                              ObjectMapper objectMapper) {
        this.securityHeaders = securityHeaders;
        this.corsPolicy = corsPolicy;
        this.policies = policies;
        this.rateLimiter = rateLimiter;
        this.authenticator = authenticator;
        this.authorizer = authorizer;
        this.schemas = schemas;
        this.validator = validator;
        this.auditLogger = auditLogger;
        this.clientInfo = clientInfo;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    void setAuditValidationFailures(boolean auditValidationFailures) {
        this.auditValidationFailures = auditValidationFailures;
    }

    void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest request = (HttpServletRequest) req;
        HttpServletResponse response = (HttpServletResponse) res;

        securityHeaders.apply(request, response);

        String method = request.getMethod();
        String origin = request.getHeader("Origin");

        if ("OPTIONS".equalsIgnoreCase(method)) {
            corsPolicy.applyPreflight(origin, response);
            response.setStatus(HttpStatus.OK.value());
            return;
        }
        corsPolicy.applyActual(origin, response);

        if (isAmbiguousPath(request)) {
            reject(response, HttpStatus.BAD_REQUEST, "invalid_path", method, request.getRequestURI(),
                    clientInfo.resolveIp(request), body(ERROR_INVALID_PATH));
            return;
        }
        String path = pathOf(request);

        Optional<EndpointPolicy> match = policies.resolve(method, path);
        if (match.isEmpty()) {
            chain.doFilter(request, response);
            return;
        }
        EndpointPolicy policy = match.get();
        String ip = clientInfo.resolveIp(request);
        String authorization = request.getHeader("Authorization");

        // Resolved at most once: for the rate-limit identity and for the auth check.
        AuthenticationResult auth = null;

        // ── RATE_LIMIT_CHECK ──
        if (policy.getRateLimit() != null) {
            if (authorization != null) {
                auth = authenticator.resolve(authorization);
            }
            String identity = auth != null && auth.isAuthenticated() ? auth.principal().id() : ip;
            // One bucket per policy and method, however the concrete path varies.
            String endpoint = method.toUpperCase(Locale.ROOT) + ":" + policy.getPattern();
            RateLimitDecision decision = rateLimiter.check(new RateLimitKey(identity, endpoint), policy.getRateLimit());

            response.setHeader("X-RateLimit-Limit", String.valueOf(decision.limit()));
            response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
            response.setHeader("X-RateLimit-Reset", String.valueOf(decision.resetAt()));

            if (!decision.admitted()) {
                response.setHeader("Retry-After", String.valueOf(decision.retryAfterSeconds()));
                String userId = auth != null && auth.isAuthenticated() ? auth.principal().id() : null;
                auditLogger.rateLimitExceeded(path, userId, request);
                reject(response, HttpStatus.TOO_MANY_REQUESTS, "rate_limited", method, path, identity,
                        body(ERROR_RATE_LIMITED, "retryAfter", decision.retryAfterSeconds()));
                return;
            }
        }

        // ── AUTH_CHECK / ROLE_CHECK ──
        Principal principal = null;
        if (policy.isRequireAuth()) {
            if (auth == null) {
                auth = authenticator.resolve(authorization);
            }
            if (!auth.isAuthenticated()) {
                auditLogger.record(AuditLogEntry.builder(AuditAction.UNAUTHORIZED_ACCESS_ATTEMPT)
                        .severity(AuditSeverity.CRITICAL)
                        .detail("attemptedResource", path)
                        .detail("method", method)
                        .detail("reason", auth.failure().name())
                        .build(), request);
                reject(response, HttpStatus.UNAUTHORIZED, "unauthenticated:" + auth.failure(), method, path, ip,
                        body(ERROR_UNAUTHENTICATED));
                return;
            }
            principal = auth.principal();

            if (!authorizer.authorize(principal, policy.getRoles())) {
                auditLogger.record(AuditLogEntry.builder(AuditAction.UNAUTHORIZED_ACCESS_ATTEMPT)
                        .severity(AuditSeverity.CRITICAL)
                        .principal(principal)
                        .detail("attemptedResource", path)
                        .detail("method", method)
                        .detail("requiredRoles", policy.getRoles().stream().map(Enum::name).sorted().toList())
                        .build(), request);
                reject(response, HttpStatus.FORBIDDEN, "forbidden", method, path, principal.id(),
                        body(ERROR_FORBIDDEN));
                return;
            }
        } else if (auth != null && auth.isAuthenticated()) {
            principal = auth.principal();
        }

        // ── VALIDATE_BODY ──
        HttpServletRequest target = request;
        Map<String, Object> validated = null;
        if (policy.getSchema() != null && !"GET".equalsIgnoreCase(method)) {
            FieldSchema<?> schema = schemas.find(policy.getSchema())
                    .orElseThrow(() -> new IllegalStateException("Unknown schema " + policy.getSchema()));
            CachedBodyHttpServletRequest wrapped;
            try {
                wrapped = new CachedBodyHttpServletRequest(request, maxBodyBytes);
            } catch (PayloadTooLargeException e) {
                reject(response, HttpStatus.PAYLOAD_TOO_LARGE, "payload_too_large", method, path, ip,
                        body(ERROR_PAYLOAD_TOO_LARGE, "maxBytes", e.getLimit()));
                return;
            }
            target = wrapped;
            Object payload;
            try {
                payload = objectMapper.readValue(wrapped.getBody(), Object.class);
            } catch (IOException e) {
                log.debug("[Security] Unparseable JSON on {} {}: {}", method, path, e.getMessage());
                auditValidationFailure(request, principal, path, List.of(ERROR_INVALID_JSON));
                reject(response, HttpStatus.BAD_REQUEST, "invalid_json", method, path, ip, body(ERROR_INVALID_JSON));
                return;
            }
            ValidationResult result = validator.validate(schema, payload);
            if (!result.success()) {
                auditValidationFailure(request, principal, path, result.errors());
                reject(response, HttpStatus.BAD_REQUEST, "invalid_input", method, path, ip,
                        body(ERROR_INVALID_INPUT, "details", result.errors()));
                return;
            }
            validated = result.dataAsMap();
        }

        // ── HANDLER_INVOKE ──
        target.setAttribute(SecurityRequestAttributes.POLICY, policy);
        if (principal != null) {
            target.setAttribute(SecurityRequestAttributes.PRINCIPAL, principal);
        }
        if (validated != null) {
            SecurityRequestAttributes.setValidatedBody(target, validated);
        }

        try {
            chain.doFilter(target, response);
        } catch (Exception e) {
            SecurityLogger.logHandlerFailure(log, method, path, e);
            if (policy.getAuditAction() != null) {
                auditLogger.suspiciousActivity(
                        "API error in " + path + " (" + policy.getAuditAction() + "): " + e.getClass().getSimpleName(),
                        principal != null ? principal.id() : null,
                        request);
            }
            if (response.isCommitted()) {
                log.error("[Security] Response already committed for {} {}, cannot send 500", method, path);
                return;
            }
            response.reset();
            String requestId = MDC.get("requestId");
            if (requestId != null) {
                response.setHeader("X-Request-Id", requestId);
            }
            securityHeaders.apply(request, response);
            corsPolicy.applyActual(origin, response);
            reject(response, HttpStatus.INTERNAL_SERVER_ERROR, "handler_error", method, path, ip, body(ERROR_INTERNAL));
        }
    }

    // ==================== HELPERS ====================

    private void auditValidationFailure(HttpServletRequest request, Principal principal, String path,
                                        List<String> errors) {
        if (!auditValidationFailures) {
            return;
        }
        auditLogger.record(AuditLogEntry.builder(AuditAction.SUSPICIOUS_ACTIVITY)
                .severity(AuditSeverity.LOW)
                .principal(principal)
                .detail("description", "Rejected invalid input")
                .detail("endpoint", path)
                .detail("errors", errors)
                .build(), request);
    }

    private void reject(HttpServletResponse response, HttpStatus status, String reason,
                        String method, String path, String identity, Map<String, Object> body) throws IOException {
        metrics.recordRejection(status.value());
        SecurityLogger.logRejected(log, status.value(), reason, method, path, identity);
        writeJson(response, status, body);
    }

    private void writeJson(HttpServletResponse response, HttpStatus status, Map<String, Object> body)
            throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            json = "{\"error\":\"" + body.get("error") + "\"}";
        }
        response.getWriter().write(json);
    }

    private static Map<String, Object> body(String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        return body;
    }

    private static Map<String, Object> body(String error, String key, Object value) {
        Map<String, Object> body = body(error);
        body.put(key, value);
        return body;
    }

    /** Decoded path within the application, without path parameters. */
    static String pathOf(HttpServletRequest request) {
        String path = PATH_HELPER.getPathWithinApplication(request);
        return path == null || path.isEmpty() ? "/" : path;
    }

    /**
     * True when the raw request URI carries anything that lets the decoded,
     * normalized path differ from a plain reading of it: path parameters,
     * encoded slashes or backslashes, double encoding, dot segments or NUL.
     */
    static boolean isAmbiguousPath(HttpServletRequest request) {
        String raw = request.getRequestURI();
        if (raw == null) {
            return false;
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.contains(";") || lower.contains("%2f") || lower.contains("%5c")
                || lower.contains("%25") || lower.contains("\\")) {
            return true;
        }
        String decoded;
        try {
            decoded = UriUtils.decode(raw, "UTF-8");
        } catch (IllegalArgumentException e) {
            log.debug("[Security] Undecodable request path {}: {}", raw, e.getMessage());
            return true;
        }
        if (decoded.indexOf('\0') >= 0) {
            return true;
        }
        for (String segment : decoded.split("/", -1)) {
            if (".".equals(segment) || "..".equals(segment)) {
                return true;
            }
        }
        return false;
    }
}
