package com.vanityhub.server.service.audit;

import java.time.Instant;

import com.vanityhub.server.exception.InvalidAuditQueryException;
import com.vanityhub.server.model.AuditAction;
import com.vanityhub.server.model.AuditSeverity;

/**
 * Filters for reading audit history. Null filters match everything.
 * Results are ordered newest first. {@code limit} must be positive and is
 * capped at {@link #MAX_LIMIT}.
 */
public record AuditQuery(String userId,
                         AuditAction action,
                         AuditSeverity severity,
                         String resourceType,
                         String resourceId,
                         Instant startDate,
                         Instant endDate,
                         int limit,
                         int offset) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public AuditQuery {
        if (limit < 1) {
            throw new InvalidAuditQueryException("limit", "limit must be at least 1");
        }
        if (offset < 0) {
            throw new InvalidAuditQueryException("offset", "offset must not be negative");
        }
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new InvalidAuditQueryException("startDate", "startDate must not be after endDate");
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, null, null, DEFAULT_LIMIT, 0);
    }
}
