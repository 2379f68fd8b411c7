package com.vanityhub.server.model;

/**
 * Closed set of security-relevant events written to the audit trail.
 */
public enum AuditAction {

    // Authentication
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    LOGOUT,
    PASSWORD_CHANGED,
    PASSWORD_RESET_REQUESTED,
    PASSWORD_RESET_COMPLETED,

    // User management
    USER_CREATED,
    USER_UPDATED,
    USER_DELETED,
    USER_ACTIVATED,
    USER_DEACTIVATED,

    // Clients
    CLIENT_CREATED,
    CLIENT_UPDATED,
    CLIENT_DELETED,
    CLIENT_VIEWED,

    // Appointments
    APPOINTMENT_CREATED,
    APPOINTMENT_UPDATED,
    APPOINTMENT_CANCELLED,
    APPOINTMENT_COMPLETED,
    APPOINTMENT_NO_SHOW,

    // Transactions
    TRANSACTION_CREATED,
    TRANSACTION_UPDATED,
    TRANSACTION_REFUNDED,
    PAYMENT_PROCESSED,

    // Inventory
    PRODUCT_CREATED,
    PRODUCT_UPDATED,
    PRODUCT_DELETED,
    STOCK_ADJUSTED,
    STOCK_LOW_ALERT,

    // Services
    SERVICE_CREATED,
    SERVICE_UPDATED,
    SERVICE_DELETED,

    // Staff
    STAFF_CREATED,
    STAFF_UPDATED,
    STAFF_DELETED,
    STAFF_SCHEDULE_UPDATED,

    // Security
    UNAUTHORIZED_ACCESS_ATTEMPT,
    RATE_LIMIT_EXCEEDED,
    SUSPICIOUS_ACTIVITY,
    DATA_EXPORT,
    BULK_OPERATION,

    // System
    SYSTEM_BACKUP,
    SYSTEM_RESTORE,
    CONFIGURATION_CHANGED,
    MAINTENANCE_MODE
}
