package com.vanityhub.server.security;

import java.util.Optional;

/**
 * Verifies a bearer token with whatever identity provider issued it.
 * Returns empty for a token that is invalid, expired or unknown.
 */
@FunctionalInterface
public interface TokenVerifier {

    Optional<TokenClaims> verify(String token);
}
