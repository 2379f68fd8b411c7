package com.vanityhub.server.service.audit;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockHttpServletRequest;

import com.vanityhub.server.exception.AuditStoreException;
import com.vanityhub.server.model.AuditAction;
import com.vanityhub.server.model.AuditLogEntry;
import com.vanityhub.server.model.AuditSeverity;
import com.vanityhub.server.service.SecurityMetricsService;
import com.vanityhub.server.service.alert.AlertService;
import com.vanityhub.server.service.alert.SecurityAlert;
import com.vanityhub.server.support.MutableClock;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AuditLoggerTest {

    private static final Executor DIRECT = Runnable::run;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private RecordingStore store;
    private AlertService alertService;
    private SimpleMeterRegistry registry;
    private SecurityMetricsService metrics;
    private AuditLogger auditLogger;

    @BeforeEach
    void setUp() {
        store = new RecordingStore();
        alertService = mock(AlertService.class);
        registry = new SimpleMeterRegistry();
        metrics = new SecurityMetricsService(registry);
        auditLogger = newLogger(store, DIRECT, 1_000);
    }

    private AuditLogger newLogger(AuditStore auditStore, Executor executor, long timeoutMs) {
        return new AuditLogger(auditStore, new ClientInfoResolver("127.0.0.1"), alertService, metrics, executor, clock, timeoutMs);
    }

    private static MockHttpServletRequest request() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/auth/login");
        request.addHeader("X-Forwarded-For", "198.51.100.4, 10.0.0.1");
        request.addHeader("User-Agent", "JUnit");
        return request;
    }

    // ===== Resolution =====

    @Test
    void shouldDeriveSeverityAndClientInfo() {
        auditLogger.record(AuditLogEntry.builder(AuditAction.PASSWORD_CHANGED).userId("u-1").build(), request());

        AuditLogEntry stored = store.single();
        assertEquals(AuditSeverity.HIGH, stored.getSeverity());
        assertEquals("198.51.100.4", stored.getIpAddress());
        assertEquals("JUnit", stored.getUserAgent());
        assertEquals(clock.instant(), stored.getCreatedAt());
    }

    @Test
    void shouldKeepExplicitSeverityAndIp() {
        auditLogger.record(AuditLogEntry.builder(AuditAction.LOGIN_SUCCESS)
                .severity(AuditSeverity.HIGH)
                .ipAddress("192.0.2.9")
                .build(), request());

        AuditLogEntry stored = store.single();
        assertEquals(AuditSeverity.HIGH, stored.getSeverity());
        assertEquals("192.0.2.9", stored.getIpAddress());
    }

    @Test
    void shouldUseUnknownWithoutRequest() {
        auditLogger.record(AuditLogEntry.builder(AuditAction.SYSTEM_BACKUP).build());

        AuditLogEntry stored = store.single();
        assertEquals(ClientInfoResolver.UNKNOWN, stored.getIpAddress());
        assertEquals(ClientInfoResolver.UNKNOWN, stored.getUserAgent());
        assertEquals(AuditSeverity.LOW, stored.getSeverity());
    }

    // ===== Alerts =====

    @Test
    void shouldDispatchExactlyOneAlertForCriticalEntry() {
        auditLogger.unauthorizedAccess("/api/admin/users", "u-9", request());

        ArgumentCaptor<SecurityAlert> alert = ArgumentCaptor.forClass(SecurityAlert.class);
        verify(alertService, times(1)).dispatch(alert.capture());
        assertEquals("UNAUTHORIZED_ACCESS_ATTEMPT", alert.getValue().action());
        assertEquals("CRITICAL", alert.getValue().severity());
        assertEquals("198.51.100.4", alert.getValue().ipAddress());
        assertEquals("/api/admin/users", alert.getValue().details().get("attemptedResource"));
    }

    @Test
    void shouldNotAlertForNonCriticalEntries() {
        auditLogger.loginFailed("x@y.example", "bad password", request());
        auditLogger.rateLimitExceeded("/api/auth/login", null, request());

        verify(alertService, never()).dispatch(any());
        assertEquals(2, store.entries.size());
        assertEquals(AuditSeverity.MEDIUM, store.entries.get(0).getSeverity());
    }

    @Test
    void shouldStillAlertWhenPersistenceFails() {
        AuditLogger failing = newLogger(new FailingStore(), DIRECT, 1_000);

        failing.suspiciousActivity("handler exploded", "u-1", request());

        verify(alertService).dispatch(any(SecurityAlert.class));
    }

    // ===== Failure containment =====

    @Test
    void shouldSwallowStoreFailureAndCountIt() {
        AuditLogger failing = newLogger(new FailingStore(), DIRECT, 1_000);

        assertDoesNotThrow(() -> failing.loginSuccess("u-1", "a@b.example", "ADMIN", request()));

        assertEquals(1.0, registry.counter("audit.write.failures").count());
        assertEquals(0, registry.find("audit.entries.recorded").counters().size());
    }

    @Test
    void shouldFallBackWhenWriteTimesOut() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        AuditStore slow = new RecordingStore() {
            @Override
            public void append(AuditLogEntry entry) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            AuditLogger slowLogger = newLogger(slow, executor, 50);

            long start = System.nanoTime();
            slowLogger.logout("u-1", "a@b.example", request());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMs < 2_000, "record took " + elapsedMs + "ms");
            assertEquals(1.0, registry.counter("audit.write.failures").count());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void shouldFallBackWhenExecutorRejects() {
        Executor saturated = r -> {
            throw new RejectedExecutionException("queue full");
        };
        AuditLogger rejecting = newLogger(store, saturated, 1_000);

        rejecting.userDeleted("u-2", "gone@salon.example", "u-1", request());

        assertTrue(store.entries.isEmpty());
        assertEquals(1.0, registry.counter("audit.write.failures").count());
        verify(alertService).dispatch(any(SecurityAlert.class));
    }

    @Test
    void shouldCountRecordedEntriesBySeverity() {
        auditLogger.logout("u-1", null, request());
        auditLogger.logout("u-1", null, request());

        assertEquals(2.0, registry.counter("audit.entries.recorded", "severity", "LOW").count());
    }

    // ===== Convenience recorders =====

    @Test
    void shouldDescribeUserMutations() {
        auditLogger.userCreated("u-2", "new@salon.example", "u-1", request());
        auditLogger.userUpdated("u-2", List.of("name", "role"), "u-1", request());

        AuditLogEntry created = store.entries.get(0);
        assertEquals(AuditAction.USER_CREATED, created.getAction());
        assertEquals(AuditSeverity.HIGH, created.getSeverity());
        assertEquals("User", created.getResourceType());
        assertEquals("u-2", created.getResourceId());
        assertEquals("new@salon.example", created.getDetails().get("createdUserEmail"));

        AuditLogEntry updated = store.entries.get(1);
        assertEquals(AuditSeverity.LOW, updated.getSeverity());
        assertEquals(List.of("name", "role"), updated.getDetails().get("updatedFields"));
    }

    @Test
    void shouldDelegateQueriesToStore() {
        auditLogger.logout("u-1", null, request());

        assertEquals(1, auditLogger.query(AuditQuery.all()).size());
    }

    // ===== Test stores =====

    static class RecordingStore implements AuditStore {
        final List<AuditLogEntry> entries = new CopyOnWriteArrayList<>();

        @Override
        public void append(AuditLogEntry entry) {
            entries.add(entry);
        }

        @Override
        public List<AuditLogEntry> query(AuditQuery query) {
            return List.copyOf(entries);
        }

        AuditLogEntry single() {
            assertEquals(1, entries.size());
            return entries.get(0);
        }
    }

    static class FailingStore implements AuditStore {
        @Override
        public void append(AuditLogEntry entry) {
            throw new AuditStoreException("database unavailable", new IllegalStateException("connection reset"));
        }

        @Override
        public List<AuditLogEntry> query(AuditQuery query) {
            throw new AuditStoreException("database unavailable", null);
        }
    }
}
