package com.kubelab.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies stateless HMAC-signed access tokens.
 * <p>
 * Tokens carry only {@code sub} (the username) and {@code exp}. Nothing is stored server-side
 * and there is no revocation: a token is valid from issue until {@code exp}.
 * <p>
 * A token is accepted if and only if its signature verifies under the configured secret and
 * algorithm, it has not expired, and its subject resolves to a user in the directory. Every
 * other outcome is an {@link UnauthorizedException} with the same external message.
 */
public final class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    /** Lifetime used by {@link #issueToken(String)} when the caller gives none. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(15);

    private final TokenSettings settings;
    private final UserDirectory directory;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;

    public TokenService(TokenSettings settings, UserDirectory directory) {
        this(settings, directory, Clock.systemUTC());
    }

    public TokenService(TokenSettings settings, UserDirectory directory, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.settings = settings;
        this.directory = directory;
        this.clock = clock;
        this.key = new SecretKeySpec(
                settings.secret().getBytes(StandardCharsets.UTF_8),
                settings.algorithm().jcaName());
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Issues a token for the user that expires after {@link #DEFAULT_TTL}.
     */
    public String issueToken(String username) {
        return issueToken(username, DEFAULT_TTL);
    }

    /**
     * Issues a token with claims {@code {sub: username, exp: now + ttl}}.
     * <p>
     * The username is not checked against the directory here; an unknown subject is rejected
     * at verification time.
     *
     * @throws IllegalArgumentException if the username is blank or the ttl is not positive
     */
    public String issueToken(String username, Duration ttl) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be null or blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Instant expiry = clock.instant().plus(ttl);
        return Jwts.builder()
                .subject(username)
                .expiration(Date.from(expiry))
                .signWith(key, settings.algorithm().macAlgorithm())
                .compact();
    }

    /**
     * Verifies a token and resolves its subject.
     *
     * @return the user named by the token's {@code sub} claim
     * @throws UnauthorizedException if the token is not accepted for any reason
     */
    public UserRecord verifyToken(String token) {
        Jws<Claims> jws = parse(token);

        String algorithm = jws.getHeader().getAlgorithm();
        if (!settings.algorithm().name().equals(algorithm)) {
            throw reject(UnauthorizedException.Reason.ALGORITHM_MISMATCH, null);
        }

        String subject = jws.getPayload().getSubject();
        if (subject == null || subject.isBlank()) {
            throw reject(UnauthorizedException.Reason.MISSING_SUBJECT, null);
        }

        return directory.find(subject)
                .orElseThrow(() -> reject(UnauthorizedException.Reason.UNKNOWN_SUBJECT, null));
    }

    /**
     * Returns the lifetime configured for tokens issued at login.
     */
    public Duration accessTokenTtl() {
        return settings.accessTokenTtl();
    }

    private Jws<Claims> parse(String token) {
        if (token == null || token.isBlank()) {
            throw reject(UnauthorizedException.Reason.MALFORMED, null);
        }
        try {
            return parser.parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            throw reject(UnauthorizedException.Reason.EXPIRED, e);
        } catch (SecurityException e) {
            throw reject(UnauthorizedException.Reason.INVALID_SIGNATURE, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw reject(UnauthorizedException.Reason.MALFORMED, e);
        }
    }

    private static UnauthorizedException reject(UnauthorizedException.Reason reason, Throwable cause) {
        log.warn("Token rejected: reason={}", reason);
        return cause == null
                ? new UnauthorizedException(reason)
                : new UnauthorizedException(reason, cause);
    }
}
