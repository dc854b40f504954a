package com.kubelab.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;

import java.util.Arrays;
import java.util.Locale;

/**
 * HMAC-SHA algorithms accepted for signing access tokens.
 */
public enum SigningAlgorithm {

    HS256(Jwts.SIG.HS256, "HmacSHA256", 32),
    HS384(Jwts.SIG.HS384, "HmacSHA384", 48),
    HS512(Jwts.SIG.HS512, "HmacSHA512", 64);

    private final MacAlgorithm macAlgorithm;
    private final String jcaName;
    private final int minKeyBytes;

    SigningAlgorithm(MacAlgorithm macAlgorithm, String jcaName, int minKeyBytes) {
        this.macAlgorithm = macAlgorithm;
        this.jcaName = jcaName;
        this.minKeyBytes = minKeyBytes;
    }

    /**
     * Resolves a JWT {@code alg} identifier such as {@code "HS256"}, ignoring case.
     *
     * @throws IllegalArgumentException for unsupported identifiers
     */
    public static SigningAlgorithm fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("algorithm must not be null or blank");
        }
        String normalized = id.strip().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(a -> a.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported token algorithm '%s', expected one of %s"
                                .formatted(id, Arrays.toString(values()))));
    }

    MacAlgorithm macAlgorithm() {
        return macAlgorithm;
    }

    String jcaName() {
        return jcaName;
    }

    /**
     * Minimum secret length in bytes for this algorithm.
     */
    int minKeyBytes() {
        return minKeyBytes;
    }
}
