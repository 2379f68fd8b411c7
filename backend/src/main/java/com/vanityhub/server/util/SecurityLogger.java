package com.vanityhub.server.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vanityhub.server.model.AuditLogEntry;

/**
 * Structured logging for security pipeline events.
 *
 * Lines are timestamp-prefixed {@code key=value} records so a rejection,
 * an alert or a lost audit entry can be found with a single grep:
 *
 * <pre>
 *   SecurityLogger.logRejected(log, 429, "rate_limited", "POST", "/api/auth/login", "10.0.0.1");
 *   SecurityLogger.logAuditFallback(fallbackLog, entry, cause);
 * </pre>
 */
public final class SecurityLogger {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private static final DateTimeFormatter formatter = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneId.of("UTC"));

    private SecurityLogger() {
    }

    // ==================== STRUCTURED LOG BUILDERS ====================

    static final class LogEntry {
        public final String timestamp;
        public final String event;
        public final Map<String, Object> data = new LinkedHashMap<>();

        LogEntry(String event) {
            this.timestamp = formatter.format(Instant.now());
            this.event = event;
        }

        LogEntry add(String key, Object value) {
            if (value != null) {
                data.put(key, value);
            }
            return this;
        }

        String toJson() {
            try {
                return objectMapper.writeValueAsString(this);
            } catch (JsonProcessingException e) {
                return String.format("{\"error\":\"Failed to serialize log\",\"event\":\"%s\"}", event);
            }
        }

        String toReadable() {
            StringBuilder sb = new StringBuilder();
            sb.append(timestamp).append(" | ").append(event).append(" |");
            data.forEach((key, value) -> sb.append(' ').append(key).append('=').append(value));
            return sb.toString();
        }
    }

    // ==================== PIPELINE ====================

    /**
     * Request stopped before reaching its handler.
     */
    public static void logRejected(Logger log, int status, String reason,
                                   String method, String path, String identity) {
        LogEntry entry = new LogEntry("REQUEST_REJECTED")
                .add("status", status)
                .add("reason", reason)
                .add("method", method)
                .add("path", path)
                .add("identity", identity);

        log.warn("[Security] {}", entry.toReadable());
    }

    /**
     * Handler threw; the client received an opaque 500.
     */
    public static void logHandlerFailure(Logger log, String method, String path, Exception e) {
        LogEntry entry = new LogEntry("HANDLER_FAILED")
                .add("method", method)
                .add("path", path)
                .add("error", e.getClass().getSimpleName())
                .add("message", e.getMessage());

        log.error("[Security] {}", entry.toReadable(), e);
    }

    // ==================== AUDIT / ALERTS ====================

    /**
     * Audit entry that could not be persisted, written in full as JSON so it
     * can be replayed into the store later.
     */
    public static void logAuditFallback(Logger fallbackLog, AuditLogEntry auditEntry, Throwable cause) {
        LogEntry entry = new LogEntry("AUDIT_WRITE_FAILED")
                .add("cause", cause == null ? null : cause.getClass().getSimpleName() + ": " + cause.getMessage())
                .add("entry", toMap(auditEntry));

        fallbackLog.error(entry.toJson());
    }

    public static void logAlert(Logger log, String action, String severity, String user,
                                String ip, Map<String, Object> details) {
        LogEntry entry = new LogEntry("SECURITY_ALERT")
                .add("action", action)
                .add("severity", severity)
                .add("user", user)
                .add("ip", ip);
        if (details != null) {
            details.forEach(entry::add);
        }

        log.warn("[Alert] {}", entry.toReadable());
    }

    static Map<String, Object> toMap(AuditLogEntry e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("action", e.getAction());
        m.put("severity", e.getSeverity());
        m.put("userId", e.getUserId());
        m.put("userEmail", e.getUserEmail());
        m.put("userRole", e.getUserRole());
        m.put("resourceType", e.getResourceType());
        m.put("resourceId", e.getResourceId());
        m.put("details", e.getDetails());
        m.put("ipAddress", e.getIpAddress());
        m.put("userAgent", e.getUserAgent());
        m.put("location", e.getLocation());
        m.put("metadata", e.getMetadata());
        m.put("createdAt", e.getCreatedAt() == null ? null : e.getCreatedAt().toString());
        return m;
    }
}
