package com.vanityhub.server.service.audit;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client address and user agent as seen through proxies.
 *
 * IP order: first hop of {@code X-Forwarded-For}, {@code X-Real-IP},
 * {@code remote-addr} header, the socket's remote address, then "unknown".
 * The three headers are read only when the socket peer is listed in
 * {@code vanityhub.request.trusted-proxies}; a {@code *} entry trusts every peer.
 */
@Component
public class ClientInfoResolver {

    public static final String UNKNOWN = "unknown";
    private static final String ANY_PROXY = "*";

    private final Set<String> trustedProxies;

    public ClientInfoResolver(
            @Value("${vanityhub.request.trusted-proxies:127.0.0.1,::1,0:0:0:0:0:0:0:1}") String trustedProxies) {
        this.trustedProxies = trustedProxies == null ? Set.of() : Arrays.stream(trustedProxies.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public String resolveIp(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        String remote = request.getRemoteAddr();
        if (!isTrustedProxy(remote)) {
            return remote == null || remote.isBlank() ? UNKNOWN : remote;
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String remoteHeader = request.getHeader("remote-addr");
        if (remoteHeader != null && !remoteHeader.isBlank()) {
            return remoteHeader.trim();
        }
        return remote == null || remote.isBlank() ? UNKNOWN : remote;
    }

    boolean isTrustedProxy(String remoteAddr) {
        return trustedProxies.contains(ANY_PROXY)
                || (remoteAddr != null && trustedProxies.contains(remoteAddr.trim()));
    }

    public String resolveUserAgent(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        String ua = request.getHeader("User-Agent");
        return ua == null || ua.isBlank() ? UNKNOWN : ua;
    }
}
