package com.vanityhub.server.service.audit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vanityhub.server.exception.AuditStoreException;
import com.vanityhub.server.model.AuditLogEntry;
import com.vanityhub.server.model.AuditLogRecord;
import com.vanityhub.server.repository.AuditLogRepository;
import com.vanityhub.server.repository.OffsetPageRequest;

/**
 * Audit store on the {@code audit_logs} table.
 *
 * Details and metadata are stored as JSON text. Every row's metadata also
 * carries the write {@code timestamp} and the deployment {@code environment}.
 */
@Service
public class JpaAuditStore implements AuditStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAuditStore.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final int MAX_USER_AGENT_LENGTH = 512;

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;
    private final String environment;

    public JpaAuditStore(AuditLogRepository repository,
                         ObjectMapper objectMapper,
                         @Value("${vanityhub.audit.environment:development}") String environment) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.environment = environment;
    }

    @Override
    @Transactional
    public void append(AuditLogEntry entry) {
        try {
            repository.save(toRecord(entry));
        } catch (DataAccessException | JsonProcessingException e) {
            throw new AuditStoreException("Failed to persist audit entry " + entry.getAction(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditLogEntry> query(AuditQuery query) {
        Specification<AuditLogRecord> spec = Specification
                .where(AuditLogRepository.userIdEquals(query.userId()))
                .and(AuditLogRepository.actionEquals(query.action()))
                .and(AuditLogRepository.severityEquals(query.severity()))
                .and(AuditLogRepository.resourceTypeEquals(query.resourceType()))
                .and(AuditLogRepository.resourceIdEquals(query.resourceId()))
                .and(AuditLogRepository.createdBetween(query.startDate(), query.endDate()));

        Sort newestFirst = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));
        try {
            return repository.findAll(spec, new OffsetPageRequest(query.offset(), query.limit(), newestFirst))
                    .map(this::toEntry)
                    .getContent();
        } catch (DataAccessException e) {
            throw new AuditStoreException("Failed to query audit log", e);
        }
    }

    // ==================== MAPPING ====================

    private AuditLogRecord toRecord(AuditLogEntry entry) throws JsonProcessingException {
        Map<String, Object> metadata = new LinkedHashMap<>(entry.getMetadata());
        metadata.put("timestamp", entry.getCreatedAt() == null ? null : entry.getCreatedAt().toString());
        metadata.put("environment", environment);

        AuditLogRecord r = new AuditLogRecord();
        r.setAction(entry.getAction());
        r.setSeverity(entry.getSeverity());
        r.setUserId(entry.getUserId());
        r.setUserEmail(entry.getUserEmail());
        r.setUserRole(entry.getUserRole());
        r.setResourceType(entry.getResourceType());
        r.setResourceId(entry.getResourceId());
        r.setDetails(entry.getDetails().isEmpty() ? null : objectMapper.writeValueAsString(entry.getDetails()));
        r.setIpAddress(entry.getIpAddress());
        r.setUserAgent(truncate(entry.getUserAgent(), MAX_USER_AGENT_LENGTH));
        r.setLocation(entry.getLocation());
        r.setMetadata(objectMapper.writeValueAsString(metadata));
        r.setCreatedAt(entry.getCreatedAt());
        return r;
    }

    private AuditLogEntry toEntry(AuditLogRecord r) {
        AuditLogEntry.Builder b = AuditLogEntry.builder(r.getAction())
                .severity(r.getSeverity())
                .userId(r.getUserId())
                .userEmail(r.getUserEmail())
                .userRole(r.getUserRole())
                .resource(r.getResourceType(), r.getResourceId())
                .ipAddress(r.getIpAddress())
                .userAgent(r.getUserAgent())
                .location(r.getLocation())
                .createdAt(r.getCreatedAt());
        readJson(r.getDetails(), r.getId()).forEach(b::detail);
        readJson(r.getMetadata(), r.getId()).forEach(b::metadata);
        return b.build();
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }

    private Map<String, Object> readJson(String json, Long id) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[Audit] Unreadable JSON column on audit row {}: {}", id, e.getOriginalMessage());
            return Map.of("raw", json);
        }
    }
}
