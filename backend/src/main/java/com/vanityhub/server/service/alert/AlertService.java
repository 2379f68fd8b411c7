package com.vanityhub.server.service.alert;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.vanityhub.server.service.SecurityMetricsService;

/**
 * Fire-and-forget alert delivery on the bounded {@code alertExecutor}.
 *
 * A full queue drops the alert (logged and counted). Dispatcher failures
 * are logged on the worker thread. Nothing propagates to the caller.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertDispatcher dispatcher;
    private final Executor alertExecutor;
    private final SecurityMetricsService metrics;

    public AlertService(AlertDispatcher dispatcher,
                        @Qualifier("alertExecutor") Executor alertExecutor,
                        SecurityMetricsService metrics) {
        this.dispatcher = dispatcher;
        this.alertExecutor = alertExecutor;
        this.metrics = metrics;
    }

    public void dispatch(SecurityAlert alert) {
        try {
            alertExecutor.execute(() -> deliver(alert));
        } catch (RejectedExecutionException e) {
            metrics.recordAlertDropped();
            log.error("[Alert] Dispatch dropped, alert queue full: {} user={} ip={}",
                    alert.action(), alert.user(), alert.ipAddress());
        }
    }

    private void deliver(SecurityAlert alert) {
        try {
            dispatcher.send(alert);
            metrics.recordAlertDispatched();
        } catch (RuntimeException e) {
            log.error("[Alert] Dispatcher {} failed for {}: {}",
                    dispatcher.getClass().getSimpleName(), alert.action(), e.toString());
        }
    }
}
