package com.vanityhub.server.config;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.vanityhub.server.security.CorsPolicy;
import com.vanityhub.server.service.alert.AlertDispatcher;
import com.vanityhub.server.service.alert.LoggingAlertDispatcher;
import com.vanityhub.server.service.alert.WebhookAlertDispatcher;

@Configuration
public class WebConfig {

    // Comma-separated list of allowed origins (set in application.properties or env)
    @Value("${app.cors.origins:http://localhost:3000}")
    private String corsOrigins;

    @Bean
    public CorsPolicy corsPolicy() {
        return CorsPolicy.fromList(corsOrigins);
    }

    // ==================== ALERT DISPATCH ====================

    @Bean
    @ConditionalOnProperty(name = "vanityhub.alert.webhook-url")
    public AlertDispatcher webhookAlertDispatcher(
            RestTemplateBuilder builder,
            @Value("${vanityhub.alert.webhook-url}") String webhookUrl,
            @Value("${vanityhub.alert.webhook-timeout-ms:5000}") long timeoutMs) {
        return new WebhookAlertDispatcher(builder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build(), webhookUrl);
    }

    @Bean
    @ConditionalOnMissingBean(AlertDispatcher.class)
    public AlertDispatcher loggingAlertDispatcher() {
        return new LoggingAlertDispatcher();
    }
}
