package com.tollgate.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthorizationHeader")
class AuthorizationHeaderTest {

    @Nested
    @DisplayName("valid headers")
    class ValidHeaders {

        @Test
        @DisplayName("splits scheme and value on the first space")
        void splitsOnFirstSpace() {
            var header = AuthorizationHeader.parse("Bearer aaa.bbb.ccc").orElseThrow();

            assertThat(header.scheme()).isEqualTo("Bearer");
            assertThat(header.value()).isEqualTo("aaa.bbb.ccc");
            assertThat(header.isBearer()).isTrue();
        }

        @Test
        @DisplayName("is case-insensitive for the scheme")
        void caseInsensitive() {
            var header = AuthorizationHeader.parse("bAsIc   dXNlcjpwYXNz").orElseThrow();

            assertThat(header.isBasic()).isTrue();
            assertThat(header.value()).isEqualTo("dXNlcjpwYXNz");
        }

        @Test
        @DisplayName("parses unsupported schemes but flags them")
        void unsupportedScheme() {
            var header = AuthorizationHeader.parse("Digest abc").orElseThrow();

            assertThat(header.isSupported()).isFalse();
        }
    }

    @Nested
    @DisplayName("invalid headers")
    class InvalidHeaders {

        @Test
        @DisplayName("returns empty for null and blank")
        void nullOrBlank() {
            assertThat(AuthorizationHeader.parse(null)).isEmpty();
            assertThat(AuthorizationHeader.parse("   ")).isEmpty();
        }

        @Test
        @DisplayName("returns empty when no credential follows the scheme")
        void schemeOnly() {
            assertThat(AuthorizationHeader.parse("Basic")).isEmpty();
            assertThat(AuthorizationHeader.parse("Basic   ")).isEmpty();
        }
    }

    @Test
    @DisplayName("never prints the credential")
    void toStringMasksValue() {
        assertThat(AuthorizationHeader.parse("Basic c2VjcmV0").orElseThrow().toString())
                .doesNotContain("c2VjcmV0");
    }
}
