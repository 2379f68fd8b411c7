package com.vanityhub.server.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One security-relevant event. Built by callers with whatever they know;
 * {@code severity}, {@code ipAddress}, {@code userAgent} and {@code createdAt}
 * are filled in by the audit logger when left unset.
 *
 * <p>Instances are immutable. Use {@link #toBuilder()} to derive a resolved copy.</p>
 */
public final class AuditLogEntry {

    private final AuditAction action;
    private final AuditSeverity severity;
    private final String userId;
    private final String userEmail;
    private final String userRole;
    private final String resourceType;
    private final String resourceId;
    private final Map<String, Object> details;
    private final String ipAddress;
    private final String userAgent;
    private final String location;
    private final Map<String, Object> metadata;
    private final Instant createdAt;

    private AuditLogEntry(Builder b) {
        if (b.action == null) {
            throw new IllegalArgumentException("Audit entry requires an action");
        }
        this.action = b.action;
        this.severity = b.severity;
        this.userId = b.userId;
        this.userEmail = b.userEmail;
        this.userRole = b.userRole;
        this.resourceType = b.resourceType;
        this.resourceId = b.resourceId;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(b.details));
        this.ipAddress = b.ipAddress;
        this.userAgent = b.userAgent;
        this.location = b.location;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.createdAt = b.createdAt;
    }

    public static Builder builder(AuditAction action) {
        return new Builder().action(action);
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .action(action)
                .severity(severity)
                .userId(userId)
                .userEmail(userEmail)
                .userRole(userRole)
                .resource(resourceType, resourceId)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .location(location)
                .createdAt(createdAt);
        b.details.putAll(details);
        b.metadata.putAll(metadata);
        return b;
    }

    public AuditAction getAction()            { return action; }
    public AuditSeverity getSeverity()        { return severity; }
    public String getUserId()                 { return userId; }
    public String getUserEmail()              { return userEmail; }
    public String getUserRole()               { return userRole; }
    public String getResourceType()           { return resourceType; }
    public String getResourceId()             { return resourceId; }
    public Map<String, Object> getDetails()   { return details; }
    public String getIpAddress()              { return ipAddress; }
    public String getUserAgent()              { return userAgent; }
    public String getLocation()               { return location; }
    public Map<String, Object> getMetadata()  { return metadata; }
    public Instant getCreatedAt()             { return createdAt; }

    @Override
    public String toString() {
        return "AuditLogEntry{action=" + action + ", severity=" + severity
                + ", userId=" + userId + ", ip=" + ipAddress + ", createdAt=" + createdAt + "}";
    }

    public static final class Builder {
        private AuditAction action;
        private AuditSeverity severity;
        private String userId;
        private String userEmail;
        private String userRole;
        private String resourceType;
        private String resourceId;
        private final Map<String, Object> details = new LinkedHashMap<>();
        private String ipAddress;
        private String userAgent;
        private String location;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant createdAt;

        private Builder() {
        }

        public Builder action(AuditAction action)         { this.action = action; return this; }
        public Builder severity(AuditSeverity severity)   { this.severity = severity; return this; }
        public Builder userId(String userId)              { this.userId = userId; return this; }
        public Builder userEmail(String userEmail)        { this.userEmail = userEmail; return this; }
        public Builder userRole(String userRole)          { this.userRole = userRole; return this; }
        public Builder ipAddress(String ipAddress)        { this.ipAddress = ipAddress; return this; }
        public Builder userAgent(String userAgent)        { this.userAgent = userAgent; return this; }
        public Builder location(String location)          { this.location = location; return this; }
        public Builder createdAt(Instant createdAt)       { this.createdAt = createdAt; return this; }

        public Builder resource(String type, String id) {
            this.resourceType = type;
            this.resourceId = id;
            return this;
        }

        public Builder principal(Principal principal) {
            if (principal != null) {
                this.userId = principal.id();
                this.userEmail = principal.email();
                this.userRole = principal.role().name();
            }
            return this;
        }

        /** Null values are skipped. */
        public Builder detail(String key, Object value) {
            if (value != null) {
                details.put(key, value);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (value != null) {
                metadata.put(key, value);
            }
            return this;
        }

        public AuditLogEntry build() {
            return new AuditLogEntry(this);
        }
    }
}
