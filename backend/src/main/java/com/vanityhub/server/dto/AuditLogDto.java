package com.vanityhub.server.dto;

import java.time.Instant;
import java.util.Map;

import com.vanityhub.server.model.AuditLogEntry;

public record AuditLogDto(String action,
                          String severity,
                          String userId,
                          String userEmail,
                          String userRole,
                          String resourceType,
                          String resourceId,
                          Map<String, Object> details,
                          String ipAddress,
                          String userAgent,
                          String location,
                          Map<String, Object> metadata,
                          Instant createdAt) {

    public static AuditLogDto from(AuditLogEntry e) {
        return new AuditLogDto(
                e.getAction().name(),
                e.getSeverity() == null ? null : e.getSeverity().name(),
                e.getUserId(),
                e.getUserEmail(),
                e.getUserRole(),
                e.getResourceType(),
                e.getResourceId(),
                e.getDetails(),
                e.getIpAddress(),
                e.getUserAgent(),
                e.getLocation(),
                e.getMetadata(),
                e.getCreatedAt());
    }
}
