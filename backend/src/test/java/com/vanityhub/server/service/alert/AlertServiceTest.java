package com.vanityhub.server.service.alert;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.vanityhub.server.model.AuditAction;
import com.vanityhub.server.model.AuditLogEntry;
import com.vanityhub.server.model.AuditSeverity;
import com.vanityhub.server.service.SecurityMetricsService;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AlertServiceTest {

    private static final Executor DIRECT = Runnable::run;

    private SimpleMeterRegistry registry;
    private SecurityMetricsService metrics;
    private AlertDispatcher dispatcher;
    private SecurityAlert alert;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SecurityMetricsService(registry);
        dispatcher = mock(AlertDispatcher.class);
        alert = new SecurityAlert("SUSPICIOUS_ACTIVITY", "CRITICAL", "u-1", "203.0.113.1",
                null, Map.of("description", "test alert"), Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void shouldDeliverAndCount() {
        new AlertService(dispatcher, DIRECT, metrics).dispatch(alert);

        verify(dispatcher).send(alert);
        assertEquals(1.0, registry.counter("alerts.dispatched").count());
    }

    @Test
    void shouldDropAndCountWhenQueueFull() {
        Executor full = r -> {
            throw new RejectedExecutionException("full");
        };

        assertDoesNotThrow(() -> new AlertService(dispatcher, full, metrics).dispatch(alert));

        verify(dispatcher, never()).send(any());
        assertEquals(1.0, registry.counter("alerts.dropped").count());
    }

    @Test
    void shouldContainDispatcherFailure() {
        doThrow(new IllegalStateException("webhook 500")).when(dispatcher).send(any());

        assertDoesNotThrow(() -> new AlertService(dispatcher, DIRECT, metrics).dispatch(alert));

        assertEquals(0.0, registry.counter("alerts.dispatched").count());
    }

    @Test
    void shouldBuildAlertFromAuditEntry() {
        AuditLogEntry entry = AuditLogEntry.builder(AuditAction.USER_DELETED)
                .severity(AuditSeverity.CRITICAL)
                .userId("u-1")
                .userEmail("admin@salon.example")
                .resource("User", "u-2")
                .ipAddress("198.51.100.1")
                .createdAt(Instant.parse("2024-01-02T00:00:00Z"))
                .build();

        SecurityAlert fromEntry = SecurityAlert.from(entry);

        assertEquals("USER_DELETED", fromEntry.action());
        assertEquals("admin@salon.example", fromEntry.user());
        assertEquals("User:u-2", fromEntry.resource());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), fromEntry.occurredAt());
    }
}
