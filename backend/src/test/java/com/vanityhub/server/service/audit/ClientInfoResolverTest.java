package com.vanityhub.server.service.audit;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class ClientInfoResolverTest {

    private final ClientInfoResolver resolver = new ClientInfoResolver("10.0.0.4, 127.0.0.1");

    @Test
    void shouldPreferFirstForwardedHop() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " 203.0.113.5 , 10.0.0.2");
        request.addHeader("X-Real-IP", "10.0.0.3");
        request.setRemoteAddr("10.0.0.4");

        assertEquals("203.0.113.5", resolver.resolveIp(request));
    }

    @Test
    void shouldFallThroughHeaderChain() {
        MockHttpServletRequest realIp = new MockHttpServletRequest();
        realIp.addHeader("X-Real-IP", "10.0.0.3");
        realIp.setRemoteAddr("10.0.0.4");

        MockHttpServletRequest remoteHeader = new MockHttpServletRequest();
        remoteHeader.addHeader("remote-addr", "10.0.0.5");
        remoteHeader.setRemoteAddr("10.0.0.4");

        MockHttpServletRequest socketOnly = new MockHttpServletRequest();
        socketOnly.setRemoteAddr("10.0.0.4");

        assertEquals("10.0.0.3", resolver.resolveIp(realIp));
        assertEquals("10.0.0.5", resolver.resolveIp(remoteHeader));
        assertEquals("10.0.0.4", resolver.resolveIp(socketOnly));
    }

    @Test
    void shouldIgnoreForwardingHeadersFromUntrustedPeer() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.99");
        request.addHeader("X-Real-IP", "203.0.113.98");
        request.setRemoteAddr("198.51.100.20");

        assertEquals("198.51.100.20", resolver.resolveIp(request));
    }

    @Test
    void shouldTrustEveryPeerWithWildcard() {
        ClientInfoResolver open = new ClientInfoResolver("*");
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.99");
        request.setRemoteAddr("198.51.100.20");

        assertEquals("203.0.113.99", open.resolveIp(request));
    }

    @Test
    void shouldTrustNoPeerWhenListIsEmpty() {
        ClientInfoResolver closed = new ClientInfoResolver("");
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.99");

        assertEquals("127.0.0.1", closed.resolveIp(request));
    }

    @Test
    void shouldReturnUnknownWhenNothingAvailable() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("");

        assertEquals(ClientInfoResolver.UNKNOWN, resolver.resolveIp(request));
        assertEquals(ClientInfoResolver.UNKNOWN, resolver.resolveIp(null));
        assertEquals(ClientInfoResolver.UNKNOWN, resolver.resolveUserAgent(request));
    }

    @Test
    void shouldReadUserAgent() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("User-Agent", "Mozilla/5.0");

        assertEquals("Mozilla/5.0", resolver.resolveUserAgent(request));
    }
}
