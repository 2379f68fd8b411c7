package com.vanityhub.server.controller;

import java.time.Instant;
import java.util.List;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.vanityhub.server.dto.AuditLogDto;
import com.vanityhub.server.middleware.EndpointPolicyRegistry;
import com.vanityhub.server.model.AuditAction;
import com.vanityhub.server.model.AuditSeverity;
import com.vanityhub.server.service.audit.AuditLogger;
import com.vanityhub.server.service.audit.AuditQuery;

/**
 * Audit history for administrators. Access is enforced by the security
 * pipeline's built-in policy for this path (ADMIN only).
 */
@RestController
@RequestMapping(EndpointPolicyRegistry.AUDIT_LOGS_PATH)
public class AuditLogController {

    private final AuditLogger auditLogger;

    public AuditLogController(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    /**
     * GET /api/admin/audit-logs?userId=&action=&severity=&resourceType=&resourceId=
     *                           &startDate=&endDate=&limit=&offset=
     * Newest first. limit defaults to 100, is capped at 1000, and a value below 1 is a 400.
     */
    @GetMapping
    public ResponseEntity<AuditLogPage> list(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) AuditAction action,
            @RequestParam(required = false) AuditSeverity severity,
            @RequestParam(required = false) String resourceType,
            @RequestParam(required = false) String resourceId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        AuditQuery query = new AuditQuery(userId, action, severity, resourceType, resourceId,
                startDate, endDate, limit, offset);
        List<AuditLogDto> entries = auditLogger.query(query).stream()
                .map(AuditLogDto::from)
                .toList();

        return ResponseEntity.ok(new AuditLogPage(entries, entries.size(), query.limit(), query.offset()));
    }

    // ── Inline DTO ──
    public record AuditLogPage(List<AuditLogDto> entries, int count, int limit, int offset) {}
}
