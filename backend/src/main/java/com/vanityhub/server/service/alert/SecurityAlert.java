package com.vanityhub.server.service.alert;

import java.time.Instant;
import java.util.Map;

import com.vanityhub.server.model.AuditLogEntry;

/**
 * Notification raised for a CRITICAL audit entry.
 */
public record SecurityAlert(String action,
                            String severity,
                            String user,
                            String ipAddress,
                            String resource,
                            Map<String, Object> details,
                            Instant occurredAt) {

    public SecurityAlert {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static SecurityAlert from(AuditLogEntry entry) {
        String user = entry.getUserEmail() != null ? entry.getUserEmail() : entry.getUserId();
        String resource = entry.getResourceType() == null ? null
                : entry.getResourceType() + ":" + entry.getResourceId();
        return new SecurityAlert(
                entry.getAction().name(),
                entry.getSeverity() == null ? null : entry.getSeverity().name(),
                user,
                entry.getIpAddress(),
                resource,
                entry.getDetails(),
                entry.getCreatedAt() != null ? entry.getCreatedAt() : Instant.now());
    }
}
