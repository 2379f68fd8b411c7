package com.vanityhub.server.middleware;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.vanityhub.server.service.audit.ClientInfoResolver;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Request correlation filter.
 *
 * Assigns a request id (or keeps a well-formed incoming {@code X-Request-Id})
 * and places it in the MDC so every log line of the request, including
 * security rejections and audit fallbacks, carries it.
 *
 * MDC keys set:
 *   - requestId
 *   - requestPath
 *   - requestMethod
 *   - clientIp
 */
@Component
@Order(0)
public class RequestCorrelationFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RequestCorrelationFilter.class);
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9-]{8,64}$");

    private final ClientInfoResolver clientInfo;

    @Value("${vanityhub.request.slow-threshold-ms:2000}")
    private long slowThresholdMs = 2000;

    public RequestCorrelationFilter(ClientInfoResolver clientInfo) {
        this.clientInfo = clientInfo;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String incoming = httpRequest.getHeader("X-Request-Id");
        String requestId = incoming != null && SAFE_ID.matcher(incoming).matches()
                ? incoming
                : UUID.randomUUID().toString().substring(0, 12);
        long startTime = System.currentTimeMillis();

        try {
            MDC.put("requestId", requestId);
            MDC.put("requestPath", httpRequest.getRequestURI());
            MDC.put("requestMethod", httpRequest.getMethod());
            MDC.put("clientIp", clientInfo.resolveIp(httpRequest));

            httpResponse.setHeader("X-Request-Id", requestId);

            chain.doFilter(request, response);

        } finally {
            long duration = System.currentTimeMillis() - startTime;
            if (!httpResponse.isCommitted()) {
                httpResponse.setHeader("X-Request-Duration-Ms", String.valueOf(duration));
            }

            if (duration > slowThresholdMs) {
                log.warn("[Slow Request] {} {} took {}ms (requestId={})",
                        httpRequest.getMethod(), httpRequest.getRequestURI(),
                        duration, requestId);
            }

            MDC.clear();
        }
    }
}
