package com.vanityhub.server.service.audit;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.vanityhub.server.model.AuditAction;
import com.vanityhub.server.model.AuditLogEntry;
import com.vanityhub.server.model.AuditSeverity;
import com.vanityhub.server.service.SecurityMetricsService;
import com.vanityhub.server.service.alert.AlertService;
import com.vanityhub.server.service.alert.SecurityAlert;
import com.vanityhub.server.util.SecurityLogger;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Records security-relevant events.
 *
 * <h3>Write path</h3>
 * <ol>
 *   <li>Severity from {@link AuditSeverityPolicy} unless the entry sets one.</li>
 *   <li>IP and user agent from the request unless the entry sets them.</li>
 *   <li>Synchronous append, bounded by {@code vanityhub.audit.write-timeout-ms}.
 *       A failed or timed-out write goes to the {@code AUDIT_FALLBACK} log
 *       as JSON and is not rethrown.</li>
 *   <li>CRITICAL entries are handed to {@link AlertService}.</li>
 * </ol>
 *
 * {@link #record} never throws into request handling.
 */
@Service
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final Logger fallbackLog = LoggerFactory.getLogger("AUDIT_FALLBACK");

    private final AuditStore store;
    private final ClientInfoResolver clientInfo;
    private final AlertService alertService;
    private final SecurityMetricsService metrics;
    private final Executor auditExecutor;
    private final Clock clock;
    private final long writeTimeoutMs;

    public AuditLogger(AuditStore store,
                       ClientInfoResolver clientInfo,
                       AlertService alertService,
                       SecurityMetricsService metrics,
                       @Qualifier("auditExecutor") Executor auditExecutor,
                       Clock clock,
                       @Value("${vanityhub.audit.write-timeout-ms:3000}") long writeTimeoutMs) {
        this.store = store;
        this.clientInfo = clientInfo;
        this.alertService = alertService;
        this.metrics = metrics;
        this.auditExecutor = auditExecutor;
        this.clock = clock;
        this.writeTimeoutMs = writeTimeoutMs;
    }

    public void record(AuditLogEntry entry) {
        record(entry, null);
    }

    public void record(AuditLogEntry entry, HttpServletRequest request) {
        AuditLogEntry resolved;
        try {
            resolved = resolve(entry, request);
        } catch (RuntimeException e) {
            log.error("[Audit] Could not resolve audit entry {}: {}", entry == null ? null : entry.getAction(), e.toString());
            return;
        }

        if (persist(resolved)) {
            metrics.recordAuditEntry(resolved.getSeverity());
            log.debug("[Audit] {} {} user={} ip={}", resolved.getSeverity(), resolved.getAction(),
                    resolved.getUserEmail() != null ? resolved.getUserEmail() : resolved.getUserId(),
                    resolved.getIpAddress());
        }

        if (resolved.getSeverity() == AuditSeverity.CRITICAL) {
            alertService.dispatch(SecurityAlert.from(resolved));
        }
    }

    public List<AuditLogEntry> query(AuditQuery query) {
        return store.query(query);
    }

    AuditLogEntry resolve(AuditLogEntry entry, HttpServletRequest request) {
        AuditLogEntry.Builder b = entry.toBuilder();
        if (entry.getSeverity() == null) {
            b.severity(AuditSeverityPolicy.severityOf(entry.getAction()));
        }
        if (entry.getIpAddress() == null) {
            b.ipAddress(clientInfo.resolveIp(request));
        }
        if (entry.getUserAgent() == null) {
            b.userAgent(clientInfo.resolveUserAgent(request));
        }
        return b.createdAt(clock.instant()).build();
    }

    private boolean persist(AuditLogEntry entry) {
        CompletableFuture<Void> write;
        try {
            write = CompletableFuture.runAsync(() -> store.append(entry), auditExecutor);
        } catch (RuntimeException e) {
            // executor saturated or shut down
            fallback(entry, e);
            return false;
        }
        try {
            write.get(writeTimeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            write.cancel(true);
            fallback(entry, e);
        } catch (ExecutionException e) {
            fallback(entry, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fallback(entry, e);
        }
        return false;
    }

    private void fallback(AuditLogEntry entry, Throwable cause) {
        metrics.recordAuditWriteFailure();
        log.error("[Audit] Failed to persist {} entry, written to fallback log: {}",
                entry.getAction(), String.valueOf(cause));
        SecurityLogger.logAuditFallback(fallbackLog, entry, cause);
    }

    // ==================== CONVENIENCE RECORDERS ====================

    public void loginSuccess(String userId, String userEmail, String userRole, HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.LOGIN_SUCCESS)
                .userId(userId).userEmail(userEmail).userRole(userRole)
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }

    public void loginFailed(String email, String reason, HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.LOGIN_FAILED)
                .userEmail(email)
                .severity(AuditSeverity.MEDIUM)
                .detail("reason", reason)
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }

    public void logout(String userId, String userEmail, HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.LOGOUT)
                .userId(userId).userEmail(userEmail)
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }

    public void passwordChanged(String userId, String userEmail, HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.PASSWORD_CHANGED)
                .userId(userId).userEmail(userEmail)
                .severity(AuditSeverity.HIGH)
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }

    public void userCreated(String createdUserId, String createdUserEmail, String creatorId,
                            HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.USER_CREATED)
                .userId(creatorId)
                .resource("User", createdUserId)
                .detail("createdUserEmail", createdUserEmail)
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }

    public void userUpdated(String updatedUserId, List<String> updatedFields, String updaterId,
                            HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.USER_UPDATED)
                .userId(updaterId)
                .resource("User", updatedUserId)
                .detail("updatedFields", updatedFields == null ? null : List.copyOf(updatedFields))
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }

    public void userDeleted(String deletedUserId, String deletedUserEmail, String deleterId,
                            HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.USER_DELETED)
                .userId(deleterId)
                .resource("User", deletedUserId)
                .severity(AuditSeverity.CRITICAL)
                .detail("deletedUserEmail", deletedUserEmail)
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }

    public void unauthorizedAccess(String attemptedResource, String userId, HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.UNAUTHORIZED_ACCESS_ATTEMPT)
                .userId(userId)
                .severity(AuditSeverity.CRITICAL)
                .detail("attemptedResource", attemptedResource)
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }

    public void rateLimitExceeded(String endpoint, String userId, HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.RATE_LIMIT_EXCEEDED)
                .userId(userId)
                .severity(AuditSeverity.MEDIUM)
                .detail("endpoint", endpoint)
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }

    public void suspiciousActivity(String description, String userId, HttpServletRequest request) {
        record(AuditLogEntry.builder(AuditAction.SUSPICIOUS_ACTIVITY)
                .userId(userId)
                .severity(AuditSeverity.CRITICAL)
                .detail("description", description)
                .detail("timestamp", clock.instant().toString())
                .build(), request);
    }
}
