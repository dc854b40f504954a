package com.kubelab.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PasswordHasher")
class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher(4);

    @Nested
    @DisplayName("hash")
    class Hash {

        @Test
        @DisplayName("produces a $2b$ bcrypt hash with the configured cost")
        void producesBcryptHash() {
            String hash = hasher.hash("testpassword");

            assertThat(hash).startsWith("$2b$04$").hasSize(60);
        }

        @Test
        @DisplayName("salts every hash so the same password hashes differently")
        void saltsEveryHash() {
            assertThat(hasher.hash("testpassword")).isNotEqualTo(hasher.hash("testpassword"));
        }

        @Test
        @DisplayName("rejects null password")
        void rejectsNull() {
            assertThatThrownBy(() -> hasher.hash(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("password");
        }

        @Test
        @DisplayName("works with the default cost outside an application context")
        void defaultStrengthStandalone() {
            assertThat(new PasswordHasher().hash("testpassword")).startsWith("$2b$12$");
        }

        @Test
        @DisplayName("rejects cost factors outside bcrypt's range")
        void rejectsBadStrength() {
            assertThatThrownBy(() -> new PasswordHasher(3))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new PasswordHasher(32))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        @DisplayName("accepts the original password")
        void acceptsOriginal() {
            String hash = hasher.hash("testpassword");

            assertThat(hasher.matches("testpassword", hash)).isTrue();
        }

        @Test
        @DisplayName("rejects a different password")
        void rejectsDifferent() {
            String hash = hasher.hash("testpassword");

            assertThat(hasher.matches("wrongpassword", hash)).isFalse();
            assertThat(hasher.matches("", hash)).isFalse();
        }

        @Test
        @DisplayName("returns false for null input or a hash that is not bcrypt")
        void falseForBadInput() {
            String hash = hasher.hash("testpassword");

            assertThat(hasher.matches(null, hash)).isFalse();
            assertThat(hasher.matches("testpassword", null)).isFalse();
            assertThat(hasher.matches("testpassword", "")).isFalse();
            assertThat(hasher.matches("testpassword", "plain-text")).isFalse();
        }

        @Test
        @DisplayName("verifies hashes made with a different cost factor")
        void verifiesOtherCost() {
            String hash = new PasswordHasher(5).hash("testpassword");

            assertThat(hasher.matches("testpassword", hash)).isTrue();
        }
    }
}
