package com.tollgate.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TraceTagBuilder")
class TraceTagBuilderTest {

    @Nested
    @DisplayName("sanitize")
    class Sanitize {

        @Test
        @DisplayName("replaces semicolons and doubles single quotes")
        void replacesSemicolonsAndDoublesQuotes() {
            assertThat(TraceTagBuilder.sanitize("o'brien;drop")).isEqualTo("o''brien_drop");
        }

        @Test
        @DisplayName("trims surrounding whitespace")
        void trimsWhitespace() {
            assertThat(TraceTagBuilder.sanitize("  curl/8.0  ")).isEqualTo("curl/8.0");
        }

        @Test
        @DisplayName("maps null to empty string")
        void nullIsEmpty() {
            assertThat(TraceTagBuilder.sanitize(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("emits only process-level keys without a request context")
        void processKeysOnly() {
            String tag = TraceTagBuilder.build("tollgate", "dba", "host:42", "base_readQuery", null);

            assertThat(tag).isEqualTo("APPLICATION=tollgate;PROFILE=dba;PROCESS_ID=host:42;TOOL_NAME=base_readQuery;");
        }

        @Test
        @DisplayName("omits segments for null fields")
        void omitsNullFields() {
            String tag = TraceTagBuilder.build("tollgate", null, "host:42", "t", RequestContext.local("req-1", "sess-1"));

            assertThat(tag)
                    .doesNotContain("PROFILE=")
                    .doesNotContain("TENANT=")
                    .doesNotContain("PROXYUSER=")
                    .doesNotContain("AUTH_HASH=")
                    .contains("REQUEST_ID=req-1;")
                    .contains("SESSION_ID=sess-1;");
        }

        @Test
        @DisplayName("carries request attributes, truncated hash and proxy user")
        void carriesRequestAttributes() {
            RequestContext ctx = RequestContext.builder("req-9")
                    .sessionId("sess-9")
                    .tenant("acme")
                    .forwardedFor("10.0.0.7, 172.16.0.1")
                    .userAgent("claude-desktop")
                    .authScheme("Basic")
                    .authTokenSha256("0123456789abcdef0123456789abcdef")
                    .assumeUser("analyst_1")
                    .headers(Map.of("user-agent", "claude-desktop"))
                    .build();

            String tag = TraceTagBuilder.build("tollgate", "dba", "host:42", "base_readQuery", ctx);

            assertThat(tag).isEqualTo("APPLICATION=tollgate;PROFILE=dba;PROCESS_ID=host:42;TOOL_NAME=base_readQuery;"
                    + "REQUEST_ID=req-9;SESSION_ID=sess-9;TENANT=acme;CLIENT_IP=10.0.0.7;USER_AGENT=claude-desktop;"
                    + "AUTH_SCHEME=Basic;AUTH_HASH=0123456789ab;PROXYUSER=analyst_1;");
        }

        @Test
        @DisplayName("sanitizes hostile header values")
        void sanitizesHostileValues() {
            RequestContext ctx = RequestContext.builder("r")
                    .userAgent("x'; SET QUERY_BAND=NONE;")
                    .build();

            String tag = TraceTagBuilder.build("tollgate", null, "h:1", "t", ctx);

            assertThat(tag).contains("USER_AGENT=x''_ SET QUERY_BAND=NONE_;");
        }

        @Test
        @DisplayName("falls back to client origin when no forwarding chain is present")
        void fallsBackToClientOrigin() {
            RequestContext ctx = RequestContext.builder("r").clientOrigin("192.168.1.5").build();

            assertThat(TraceTagBuilder.build("a", null, "h:1", "t", ctx)).contains("CLIENT_IP=192.168.1.5;");
        }
    }

    @Test
    @DisplayName("process identity is host:pid")
    void processIdentity() {
        assertThat(TraceTagBuilder.processIdentity())
                .endsWith(":" + ProcessHandle.current().pid());
    }
}
