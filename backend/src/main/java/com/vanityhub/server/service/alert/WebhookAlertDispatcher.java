package com.vanityhub.server.service.alert;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

/**
 * Posts alerts as JSON to an operator webhook (Slack-compatible {@code text}
 * field plus the structured alert).
 */
public class WebhookAlertDispatcher implements AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertDispatcher.class);

    private final RestTemplate restTemplate;
    private final String webhookUrl;

    public WebhookAlertDispatcher(RestTemplate restTemplate, String webhookUrl) {
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl;
        log.info("[Alert] Webhook alerting enabled");
    }

    @Override
    public void send(SecurityAlert alert) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", "SECURITY ALERT: " + alert.action()
                + (alert.user() != null ? " by " + alert.user() : "")
                + (alert.ipAddress() != null ? " from " + alert.ipAddress() : ""));
        body.put("alert", alert);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        restTemplate.postForEntity(webhookUrl, new HttpEntity<>(body, headers), String.class);
    }
}
