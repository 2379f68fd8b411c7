package com.vanityhub.server.service.audit;

import com.vanityhub.server.model.AuditAction;
import com.vanityhub.server.model.AuditSeverity;

/**
 * Default severity per audit action, used when an entry does not carry one.
 * The switch is exhaustive, so a new action does not compile until it is classified.
 */
public final class AuditSeverityPolicy {

    private AuditSeverityPolicy() {
    }

    public static AuditSeverity severityOf(AuditAction action) {
        return switch (action) {
            case USER_DELETED,
                 SYSTEM_RESTORE,
                 UNAUTHORIZED_ACCESS_ATTEMPT,
                 SUSPICIOUS_ACTIVITY -> AuditSeverity.CRITICAL;

            case PASSWORD_CHANGED,
                 USER_CREATED,
                 USER_DEACTIVATED,
                 TRANSACTION_REFUNDED,
                 DATA_EXPORT,
                 CONFIGURATION_CHANGED -> AuditSeverity.HIGH;

            case LOGIN_FAILED,
                 RATE_LIMIT_EXCEEDED,
                 APPOINTMENT_CANCELLED,
                 STOCK_ADJUSTED -> AuditSeverity.MEDIUM;

            case LOGIN_SUCCESS, LOGOUT, PASSWORD_RESET_REQUESTED, PASSWORD_RESET_COMPLETED,
                 USER_UPDATED, USER_ACTIVATED,
                 CLIENT_CREATED, CLIENT_UPDATED, CLIENT_DELETED, CLIENT_VIEWED,
                 APPOINTMENT_CREATED, APPOINTMENT_UPDATED, APPOINTMENT_COMPLETED, APPOINTMENT_NO_SHOW,
                 TRANSACTION_CREATED, TRANSACTION_UPDATED, PAYMENT_PROCESSED,
                 PRODUCT_CREATED, PRODUCT_UPDATED, PRODUCT_DELETED, STOCK_LOW_ALERT,
                 SERVICE_CREATED, SERVICE_UPDATED, SERVICE_DELETED,
                 STAFF_CREATED, STAFF_UPDATED, STAFF_DELETED, STAFF_SCHEDULE_UPDATED,
                 BULK_OPERATION,
                 SYSTEM_BACKUP, MAINTENANCE_MODE -> AuditSeverity.LOW;
        };
    }
}
