package com.vanityhub.server.service.audit;

import java.util.List;

import com.vanityhub.server.exception.AuditStoreException;
import com.vanityhub.server.model.AuditLogEntry;

/**
 * Append-only audit persistence.
 */
public interface AuditStore {

    /** Persist one fully resolved entry. Returns only once the write is durable. */
    void append(AuditLogEntry entry) throws AuditStoreException;

    List<AuditLogEntry> query(AuditQuery query) throws AuditStoreException;
}
