package com.vanityhub.server.service;

import org.springframework.stereotype.Service;

import com.vanityhub.server.model.AuditSeverity;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for the request security pipeline.
 *
 * Tagged counters are resolved through the registry (which caches them);
 * untagged ones are registered once up front.
 *
 * Exposed via: /actuator/prometheus
 */
@Service
public class SecurityMetricsService {

    private final MeterRegistry registry;

    private final Counter rateLimitStoreFailures;
    private final Counter auditWriteFailures;
    private final Counter alertsDispatched;
    private final Counter alertsDropped;

    public SecurityMetricsService(MeterRegistry registry) {
        this.registry = registry;

        this.rateLimitStoreFailures = Counter.builder("security.ratelimit.store_failures")
                .description("Rate-limit store errors handled by the fail-open/fail-closed policy")
                .register(registry);

        this.auditWriteFailures = Counter.builder("audit.write.failures")
                .description("Audit entries that could not be persisted and went to the fallback log")
                .register(registry);

        this.alertsDispatched = Counter.builder("alerts.dispatched")
                .description("Security alerts delivered to the dispatcher")
                .register(registry);

        this.alertsDropped = Counter.builder("alerts.dropped")
                .description("Security alerts dropped because the alert queue was full")
                .register(registry);
    }

    public void recordRejection(int status) {
        Counter.builder("security.requests.rejected")
                .description("Requests rejected by the security pipeline")
                .tag("status", String.valueOf(status))
                .register(registry)
                .increment();
    }

    public void recordAuditEntry(AuditSeverity severity) {
        Counter.builder("audit.entries.recorded")
                .description("Audit entries recorded, by severity")
                .tag("severity", severity.name())
                .register(registry)
                .increment();
    }

    public void recordRateLimitStoreFailure() { rateLimitStoreFailures.increment(); }
    public void recordAuditWriteFailure()     { auditWriteFailures.increment(); }
    public void recordAlertDispatched()       { alertsDispatched.increment(); }
    public void recordAlertDropped()          { alertsDropped.increment(); }
}
