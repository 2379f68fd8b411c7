package com.vanityhub.server.service.alert;

/**
 * Delivers security alerts to operators (log, webhook, pager).
 * Implementations may block and may throw; {@link AlertService} isolates both.
 */
public interface AlertDispatcher {

    void send(SecurityAlert alert);
}
