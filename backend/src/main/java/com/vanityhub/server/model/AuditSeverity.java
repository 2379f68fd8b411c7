package com.vanityhub.server.model;

/**
 * Ascending criticality tiers. CRITICAL entries trigger an alert.
 */
public enum AuditSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
