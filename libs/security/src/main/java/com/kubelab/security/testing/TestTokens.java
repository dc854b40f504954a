package com.kubelab.security.testing;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

/**
 * Builds signed tokens for tests: past expiries, foreign secrets, other HMAC algorithms and
 * raw payloads such as a null or missing {@code sub}.
 * <p>
 * Lives in the main source set under {@code testing} so service modules can use it from their
 * test scope.
 */
public final class TestTokens {

    private TestTokens() {
        // utility class
    }

    /**
     * HS256 token for the subject, expiring at the given instant (which may be in the past).
     */
    public static String hs256(String secret, String subject, Instant expiresAt) {
        return signed(secret, Jwts.SIG.HS256, subject, expiresAt);
    }

    /**
     * HS256 token whose payload is exactly the given JSON document.
     */
    public static String hs256(String secret, String payloadJson) {
        return Jwts.builder()
                .content(payloadJson.getBytes(StandardCharsets.UTF_8))
                .signWith(key(secret), Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Token for the subject signed with the given HMAC algorithm.
     */
    public static String signed(String secret, MacAlgorithm algorithm, String subject, Instant expiresAt) {
        return Jwts.builder()
                .subject(subject)
                .expiration(Date.from(expiresAt))
                .signWith(key(secret), algorithm)
                .compact();
    }

    private static SecretKey key(String secret) {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
