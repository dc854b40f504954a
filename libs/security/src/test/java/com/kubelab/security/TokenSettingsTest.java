package com.kubelab.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenSettings")
class TokenSettingsTest {

    private static final String SECRET = "your-secret-key-change-this-in-production";

    @Nested
    @DisplayName("defaults and validation")
    class Validation {

        @Test
        @DisplayName("defaults to HS256 and a 30 minute login token lifetime")
        void appliesDefaults() {
            var settings = new TokenSettings(SECRET, null, null);

            assertThat(settings.algorithm()).isEqualTo(SigningAlgorithm.HS256);
            assertThat(settings.accessTokenTtl()).isEqualTo(Duration.ofMinutes(30));
        }

        @Test
        @DisplayName("rejects a blank secret")
        void rejectsBlankSecret() {
            assertThatThrownBy(() -> new TokenSettings(" ", null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("secret");
        }

        @Test
        @DisplayName("rejects a secret shorter than the algorithm's key size")
        void rejectsShortSecret() {
            assertThatThrownBy(() -> new TokenSettings("too-short", SigningAlgorithm.HS256, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("32 bytes");
            assertThatThrownBy(() -> new TokenSettings(SECRET, SigningAlgorithm.HS512, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("64 bytes");
        }

        @Test
        @DisplayName("rejects a non-positive token lifetime")
        void rejectsNonPositiveTtl() {
            assertThatThrownBy(() -> new TokenSettings(SECRET, null, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("accessTokenTtl");
        }

        @Test
        @DisplayName("never prints the secret")
        void toStringHidesSecret() {
            assertThat(new TokenSettings(SECRET, null, null).toString())
                    .doesNotContain(SECRET)
                    .contains("HS256");
        }
    }

    @Nested
    @DisplayName("SigningAlgorithm.fromId")
    class FromId {

        @Test
        @DisplayName("resolves identifiers ignoring case")
        void resolvesIgnoringCase() {
            assertThat(SigningAlgorithm.fromId("HS256")).isEqualTo(SigningAlgorithm.HS256);
            assertThat(SigningAlgorithm.fromId("hs384")).isEqualTo(SigningAlgorithm.HS384);
            assertThat(SigningAlgorithm.fromId(" HS512 ")).isEqualTo(SigningAlgorithm.HS512);
        }

        @Test
        @DisplayName("rejects asymmetric and unknown algorithms")
        void rejectsUnsupported() {
            assertThatThrownBy(() -> SigningAlgorithm.fromId("RS256"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("RS256");
            assertThatThrownBy(() -> SigningAlgorithm.fromId("none"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> SigningAlgorithm.fromId(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
