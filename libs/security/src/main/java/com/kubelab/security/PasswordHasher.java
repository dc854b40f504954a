package com.kubelab.security;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder.BCryptVersion;

/**
 * Salted, adaptive password hashing with bcrypt.
 * <p>
 * Every call to {@link #hash(String)} draws a fresh random salt, so hashing the same password
 * twice yields different strings. Verification goes through bcrypt's own comparator, never a
 * plain string equality.
 */
public final class PasswordHasher {

    /** Default bcrypt cost factor (2^12 rounds). */
    public static final int DEFAULT_STRENGTH = 12;

    private final BCryptPasswordEncoder encoder;

    public PasswordHasher() {
        this(DEFAULT_STRENGTH);
    }

    /**
     * @param strength bcrypt log rounds, 4 to 31
     */
    public PasswordHasher(int strength) {
        this.encoder = new BCryptPasswordEncoder(BCryptVersion.$2B, strength);
    }

    /**
     * Hashes a plaintext password. The result starts with {@code $2b$}.
     *
     * @throws IllegalArgumentException if the password is null
     */
    public String hash(String password) {
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        return encoder.encode(password);
    }

    /**
     * Checks a plaintext password against a bcrypt hash. Returns false for null input or a
     * hash that is not bcrypt.
     */
    public boolean matches(String password, String hash) {
        if (password == null || hash == null || hash.isBlank()) {
            return false;
        }
        return encoder.matches(password, hash);
    }
}
