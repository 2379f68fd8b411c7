package com.vanityhub.server.security;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.vanityhub.server.model.Principal;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

/**
 * HS256 token verifier and issuer.
 *
 * <h3>Key rotation</h3>
 * Tokens are signed with the current key. When
 * {@code vanityhub.jwt.previous-secret} is set, tokens signed with the
 * previous key are still accepted until they expire.
 *
 * Token claims:
 *   sub       = user id
 *   email     = user email
 *   role      = role name
 *   locations = location ids the user may act on
 *   jti, iat, exp
 */
@Component
public class JwtTokenVerifier implements TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenVerifier.class);
    private static final String CURRENT_KID = "current";

    private final SecretKey currentKey;
    private final SecretKey previousKey;  // null if no rotation in progress
    private final long expirationMs;

    public JwtTokenVerifier(
            @Value("${vanityhub.jwt.secret}") String secret,
            @Value("${vanityhub.jwt.previous-secret:}") String previousSecret,
            @Value("${vanityhub.jwt.expiration-ms:86400000}") long expirationMs) {
        this.currentKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.previousKey = (previousSecret != null && !previousSecret.isBlank())
                ? Keys.hmacShaKeyFor(previousSecret.getBytes(StandardCharsets.UTF_8))
                : null;
        this.expirationMs = expirationMs;

        if (this.previousKey != null) {
            log.info("[JWT] Key rotation active, accepting tokens signed with current and previous keys");
        }
    }

    // ==================== TOKEN ISSUE ====================

    public String issue(Principal principal) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + expirationMs);

        return Jwts.builder()
                .header().keyId(CURRENT_KID).and()
                .subject(principal.id())
                .claim("email", principal.email())
                .claim("role", principal.role().name())
                .claim("locations", List.copyOf(principal.authorizedLocations()))
                .id(UUID.randomUUID().toString())
                .issuedAt(now)
                .expiration(expiry)
                .signWith(currentKey, Jwts.SIG.HS256)
                .compact();
    }

    // ==================== VERIFICATION ====================

    @Override
    public Optional<TokenClaims> verify(String token) {
        try {
            Claims claims = parse(token);
            return Optional.of(new TokenClaims(
                    claims.getSubject(),
                    claims.get("email", String.class),
                    claims.get("role", String.class),
                    locations(claims.get("locations"))));
        } catch (ExpiredJwtException e) {
            log.debug("[JWT] Token expired: {}", e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[JWT] Token rejected: {}", e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Tries the current key first, then the previous key if rotation is active.
     */
    private Claims parse(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(currentKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw e;
        } catch (JwtException e) {
            if (previousKey == null) throw e;
        }

        return Jwts.parser()
                .verifyWith(previousKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    private static List<String> locations(Object raw) {
        if (raw instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
