package com.tollgate.server.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import com.tollgate.observability.RequestContext;
import com.tollgate.server.infrastructure.web.RequestContextFilter;
import io.modelcontextprotocol.server.DefaultMcpTransportContext;
import io.modelcontextprotocol.server.McpTransportContext;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.function.ServerRequest;

@DisplayName("RequestContextTransportExtractor")
class RequestContextTransportExtractorTest {

    private final RequestContextTransportExtractor extractor = new RequestContextTransportExtractor();

    @Test
    @DisplayName("copies the filter's context into the transport context")
    void copiesCapturedContext() {
        RequestContext context = RequestContext.builder("req-1").sessionId("sess-1").build();
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("POST", "/mcp");
        servletRequest.setAttribute(RequestContextFilter.CONTEXT_ATTRIBUTE, context);

        McpTransportContext extracted = extractor.extract(ServerRequest.create(servletRequest, List.of()),
                new DefaultMcpTransportContext());

        assertThat(extracted.get(GatewayToolSpecifications.CONTEXT_KEY)).isSameAs(context);
    }

    @Test
    @DisplayName("leaves the transport context empty for unfiltered requests")
    void unfilteredRequest() {
        McpTransportContext extracted = extractor.extract(
                ServerRequest.create(new MockHttpServletRequest("POST", "/mcp"), List.of()),
                new DefaultMcpTransportContext());

        assertThat(extracted.get(GatewayToolSpecifications.CONTEXT_KEY)).isNull();
    }
}
