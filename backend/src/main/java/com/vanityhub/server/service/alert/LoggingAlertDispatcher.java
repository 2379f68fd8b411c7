package com.vanityhub.server.service.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vanityhub.server.util.SecurityLogger;

/** Writes alerts to the application log at WARN. */
public class LoggingAlertDispatcher implements AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertDispatcher.class);

    @Override
    public void send(SecurityAlert alert) {
        SecurityLogger.logAlert(log, alert.action(), alert.severity(), alert.user(),
                alert.ipAddress(), alert.details());
    }
}
