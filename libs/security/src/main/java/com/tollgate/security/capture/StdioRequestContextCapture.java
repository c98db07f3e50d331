package com.tollgate.security.capture;

import com.tollgate.observability.RequestContext;

import java.util.UUID;

/**
 * Capture for the local stdio channel: identifiers only. Headers are never inspected and the
 * capture never fails.
 */
public class StdioRequestContextCapture implements RequestContextCapture<TransportRequest> {

    @Override
    public RequestContext capture(TransportRequest request) {
        String requestId = UUID.randomUUID().toString();
        String sessionId = request == null ? null : request.protocolSessionId();
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = UUID.randomUUID().toString();
        }
        return RequestContext.local(requestId, sessionId);
    }
}
