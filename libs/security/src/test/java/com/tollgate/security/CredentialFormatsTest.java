package com.tollgate.security;

import com.tollgate.observability.RequestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CredentialFormats")
class CredentialFormatsTest {

    private static String b64(String raw) {
        return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("identifiers")
    class Identifiers {

        @ParameterizedTest
        @ValueSource(strings = {"analyst_1", "A", "abcdefghijabcdefghijabcdefghij"})
        @DisplayName("accepts word characters up to 30 long")
        void accepts(String candidate) {
            assertThat(CredentialFormats.isValidIdentifier(candidate)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "bob-smith", "bob smith", "x'; DROP", "abcdefghijabcdefghijabcdefghijk"})
        @DisplayName("rejects anything else")
        void rejects(String candidate) {
            assertThat(CredentialFormats.isValidIdentifier(candidate)).isFalse();
        }
    }

    @Nested
    @DisplayName("bearer tokens")
    class BearerTokens {

        @Test
        @DisplayName("requires three non-empty segments")
        void threeSegments() {
            assertThat(CredentialFormats.isValidBearerToken("a.b.c")).isTrue();
            assertThat(CredentialFormats.isValidBearerToken("a.b")).isFalse();
            assertThat(CredentialFormats.isValidBearerToken("a..c")).isFalse();
            assertThat(CredentialFormats.isValidBearerToken("a.b.c.d")).isFalse();
            assertThat(CredentialFormats.isValidBearerToken("a.b.")).isFalse();
        }
    }

    @Nested
    @DisplayName("basic decoding")
    class BasicDecoding {

        @Test
        @DisplayName("splits on the first colon and trims")
        void decodes() {
            var creds = CredentialFormats.decodeBasic(b64(" alice : pa:ss ")).orElseThrow();

            assertThat(creds.username()).isEqualTo("alice");
            assertThat(creds.secret()).isEqualTo("pa:ss");
        }

        @Test
        @DisplayName("rejects values without a colon")
        void noColon() {
            assertThat(CredentialFormats.decodeBasic(b64("alice"))).isEmpty();
        }

        @Test
        @DisplayName("rejects invalid base64")
        void notBase64() {
            assertThat(CredentialFormats.decodeBasic("%%%not-base64")).isEmpty();
        }

        @Test
        @DisplayName("rejects bytes that are not UTF-8")
        void notUtf8() {
            String encoded = Base64.getEncoder().encodeToString(new byte[] {(byte) 0xC3, (byte) 0x28, ':', 'x'});

            assertThat(CredentialFormats.decodeBasic(encoded)).isEmpty();
        }
    }

    @Test
    @DisplayName("fingerprint combines header digest prefix and origin")
    void fingerprint() {
        String fp = CredentialHashes.fingerprint("Basic abc", "10.0.0.1");

        assertThat(fp).matches("[0-9a-f]{16}:10\\.0\\.0\\.1");
        assertThat(CredentialHashes.fingerprint(null, null)).isEqualTo("unknown");
        assertThat(CredentialHashes.fingerprint(null, "10.0.0.1")).isEqualTo("10.0.0.1");
    }

    @Test
    @DisplayName("fingerprint follows the forwarded hop, so an untrusted X-Forwarded-For changes the bucket")
    void fingerprintFollowsForwardedHop() {
        RequestContext direct = RequestContext.builder("req-1").clientOrigin("10.0.0.9").build();
        RequestContext forwarded = RequestContext.builder("req-2").clientOrigin("10.0.0.9")
                .forwardedFor("203.0.113.7, 10.0.0.9").build();

        String directId = CredentialHashes.fingerprint("Basic abc", direct.clientIp());
        String forwardedId = CredentialHashes.fingerprint("Basic abc", forwarded.clientIp());

        assertThat(directId).endsWith(":10.0.0.9");
        assertThat(forwardedId).endsWith(":203.0.113.7").isNotEqualTo(directId);
    }
}
