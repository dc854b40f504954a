package com.kubelab.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Nested
    @DisplayName("require")
    class Require {

        @Test
        @DisplayName("returns the token for a bearer header")
        void returnsToken() {
            assertThat(BearerTokenExtractor.require("Bearer abc.def.ghi")).isEqualTo("abc.def.ghi");
        }

        @Test
        @DisplayName("tolerates extra whitespace and any scheme casing")
        void toleratesWhitespaceAndCase() {
            assertThat(BearerTokenExtractor.require("Bearer   my-token")).isEqualTo("my-token");
            assertThat(BearerTokenExtractor.require("bearer my-token")).isEqualTo("my-token");
            assertThat(BearerTokenExtractor.require("BEARER\tmy-token")).isEqualTo("my-token");
        }

        @ParameterizedTest(name = "[{index}] \"{0}\"")
        @NullSource
        @ValueSource(strings = {"", "   ", "Bearer", "Bearer   ", "token-without-scheme", "Bearermy-token"})
        @DisplayName("fails with 'Not authenticated' when no credentials are present")
        void notAuthenticated(String header) {
            assertThatThrownBy(() -> BearerTokenExtractor.require(header))
                    .isInstanceOf(MissingCredentialsException.class)
                    .hasMessage(MissingCredentialsException.NOT_AUTHENTICATED);
        }

        @Test
        @DisplayName("fails with 'Invalid authentication credentials' for another scheme")
        void invalidScheme() {
            assertThatThrownBy(() -> BearerTokenExtractor.require("Basic dXNlcjpwYXNz"))
                    .isInstanceOf(MissingCredentialsException.class)
                    .hasMessage(MissingCredentialsException.INVALID_SCHEME);
        }

        @Test
        @DisplayName("does not treat a scheme merely starting with 'bearer' as Bearer")
        void rejectsLookalikeScheme() {
            assertThatThrownBy(() -> BearerTokenExtractor.require("Bearerish my-token"))
                    .isInstanceOf(MissingCredentialsException.class)
                    .hasMessage(MissingCredentialsException.INVALID_SCHEME);
        }
    }
}
