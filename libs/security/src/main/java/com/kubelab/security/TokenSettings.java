package com.kubelab.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Process-wide token signing settings, read once at startup.
 *
 * @param secret         HMAC signing secret
 * @param algorithm      signing algorithm (defaults to HS256 when null)
 * @param accessTokenTtl lifetime of tokens issued at login (defaults to 30 minutes when null)
 */
public record TokenSettings(String secret, SigningAlgorithm algorithm, Duration accessTokenTtl) {

    public static final Duration DEFAULT_ACCESS_TOKEN_TTL = Duration.ofMinutes(30);

    public TokenSettings {
        if (algorithm == null) {
            algorithm = SigningAlgorithm.HS256;
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = DEFAULT_ACCESS_TOKEN_TTL;
        }
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        if (secret.getBytes(StandardCharsets.UTF_8).length < algorithm.minKeyBytes()) {
            throw new IllegalArgumentException("secret must be at least %d bytes for %s"
                    .formatted(algorithm.minKeyBytes(), algorithm));
        }
        if (accessTokenTtl.isNegative() || accessTokenTtl.isZero()) {
            throw new IllegalArgumentException("accessTokenTtl must be positive");
        }
    }

    @Override
    public String toString() {
        return "TokenSettings[algorithm=" + algorithm + ", accessTokenTtl=" + accessTokenTtl + "]";
    }
}
