package com.tollgate.security.capture;

import com.tollgate.observability.RequestContext;
import com.tollgate.security.AuthMode;
import com.tollgate.security.GatewaySettings;
import com.tollgate.security.TransportKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StdioRequestContextCapture")
class StdioRequestContextCaptureTest {

    private final StdioRequestContextCapture capture = new StdioRequestContextCapture();

    @Test
    @DisplayName("never reads headers, even credential ones")
    void ignoresHeaders() {
        RequestContext ctx = capture.capture(new TransportRequest(
                Map.of("Authorization", "Basic abc", "X-Assume-User", "root", "X-Tenant", "t"), "sess", null));

        assertThat(ctx.headers()).isEmpty();
        assertThat(ctx.authScheme()).isNull();
        assertThat(ctx.assumeUser()).isNull();
        assertThat(ctx.tenant()).isNull();
        assertThat(ctx.sessionId()).isEqualTo("sess");
    }

    @Test
    @DisplayName("generates distinct request and session ids when none are given")
    void generatesIds() {
        RequestContext a = capture.capture(TransportRequest.local(null));
        RequestContext b = capture.capture(null);

        assertThat(a.requestId()).isNotEqualTo(b.requestId());
        assertThat(a.sessionId()).isNotBlank().isNotEqualTo(a.requestId());
    }

    @Test
    @DisplayName("is selected for the stdio transport regardless of auth mode")
    void selectedForStdio() {
        var settings = new GatewaySettings(AuthMode.BASIC, Duration.ofSeconds(300), 5,
                Duration.ofSeconds(60), TransportKind.STDIO, "tollgate", null);

        assertThat(RequestContextCaptures.forSettings(settings, null, null, null))
                .isInstanceOf(StdioRequestContextCapture.class);
    }
}
