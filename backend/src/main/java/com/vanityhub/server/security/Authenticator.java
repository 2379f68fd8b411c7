package com.vanityhub.server.security;

import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.vanityhub.server.model.Principal;
import com.vanityhub.server.model.Role;

/**
 * Turns an {@code Authorization} header into a {@link Principal}.
 *
 * <p>Verification runs on {@code authExecutor} and is abandoned after
 * {@code vanityhub.auth.verify-timeout-ms}. A timeout or a verifier error
 * yields an unauthenticated result; it is never treated as success.</p>
 */
@Component
public class Authenticator {

    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);
    private static final String BEARER = "bearer ";

    private final TokenVerifier verifier;
    private final Executor executor;
    private final long timeoutMs;

    public Authenticator(TokenVerifier verifier,
                         @Qualifier("authExecutor") Executor executor,
                         @Value("${vanityhub.auth.verify-timeout-ms:2000}") long timeoutMs) {
        this.verifier = verifier;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    public AuthenticationResult resolve(String authorizationHeader) {
        Optional<String> token = extractBearer(authorizationHeader);
        if (token.isEmpty()) {
            return AuthenticationResult.failure(AuthenticationResult.Failure.MISSING);
        }

        CompletableFuture<Optional<TokenClaims>> pending;
        try {
            pending = CompletableFuture.supplyAsync(() -> verifier.verify(token.get()), executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Auth] Token verification rejected, executor saturated: {}", e.getMessage());
            return AuthenticationResult.failure(AuthenticationResult.Failure.TIMEOUT);
        }
        Optional<TokenClaims> claims;
        try {
            claims = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.warn("[Auth] Token verification timed out after {}ms", timeoutMs);
            return AuthenticationResult.failure(AuthenticationResult.Failure.TIMEOUT);
        } catch (ExecutionException e) {
            log.warn("[Auth] Token verifier failed: {}", String.valueOf(e.getCause()));
            return AuthenticationResult.failure(AuthenticationResult.Failure.TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Auth] Interrupted while verifying token");
            return AuthenticationResult.failure(AuthenticationResult.Failure.TIMEOUT);
        }

        if (claims == null || claims.isEmpty()) {
            return AuthenticationResult.failure(AuthenticationResult.Failure.INVALID);
        }
        return toPrincipal(claims.get())
                .map(AuthenticationResult::success)
                .orElseGet(() -> AuthenticationResult.failure(AuthenticationResult.Failure.INVALID));
    }

    static Optional<String> extractBearer(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String trimmed = header.trim();
        if (trimmed.length() <= BEARER.length()
                || !trimmed.substring(0, BEARER.length()).toLowerCase(Locale.ROOT).equals(BEARER)) {
            return Optional.empty();
        }
        String token = trimmed.substring(BEARER.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    private static Optional<Principal> toPrincipal(TokenClaims claims) {
        if (claims.subject() == null || claims.subject().isBlank()) {
            log.debug("[Auth] Token has no subject");
            return Optional.empty();
        }
        Optional<Role> role = Role.fromClaim(claims.role());
        if (role.isEmpty()) {
            log.debug("[Auth] Token for {} has unknown role '{}'", claims.subject(), claims.role());
            return Optional.empty();
        }
        return Optional.of(new Principal(claims.subject(), claims.email(), role.get(),
                new HashSet<>(claims.locations())));
    }
}
