package com.vanityhub.server.repository;

import java.time.Instant;

import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import com.vanityhub.server.model.AuditAction;
import com.vanityhub.server.model.AuditLogRecord;
import com.vanityhub.server.model.AuditSeverity;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogRecord, Long>,
        JpaSpecificationExecutor<AuditLogRecord> {

    // ==================== FILTER SPECIFICATIONS ====================

    static Specification<AuditLogRecord> userIdEquals(String userId) {
        return (root, q, cb) -> userId == null ? null : cb.equal(root.get("userId"), userId);
    }

    static Specification<AuditLogRecord> actionEquals(AuditAction action) {
        return (root, q, cb) -> action == null ? null : cb.equal(root.get("action"), action);
    }

    static Specification<AuditLogRecord> severityEquals(AuditSeverity severity) {
        return (root, q, cb) -> severity == null ? null : cb.equal(root.get("severity"), severity);
    }

    static Specification<AuditLogRecord> resourceTypeEquals(String resourceType) {
        return (root, q, cb) -> resourceType == null ? null : cb.equal(root.get("resourceType"), resourceType);
    }

    static Specification<AuditLogRecord> resourceIdEquals(String resourceId) {
        return (root, q, cb) -> resourceId == null ? null : cb.equal(root.get("resourceId"), resourceId);
    }

    static Specification<AuditLogRecord> createdBetween(Instant start, Instant end) {
        return (root, q, cb) -> {
            if (start != null && end != null) {
                return cb.between(root.<Instant>get("createdAt"), start, end);
            }
            if (start != null) {
                return cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), start);
            }
            if (end != null) {
                return cb.lessThanOrEqualTo(root.<Instant>get("createdAt"), end);
            }
            return null;
        };
    }
}
