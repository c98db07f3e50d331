package com.tollgate.security.capture;

import com.tollgate.observability.SensitiveDataRedactor;
import com.tollgate.security.CredentialValidator;
import com.tollgate.security.GatewaySettings;
import com.tollgate.security.SessionPrincipalCache;

/**
 * Chooses the capture strategy for the configured transport.
 */
public final class RequestContextCaptures {

    private RequestContextCaptures() {
        // utility class
    }

    public static RequestContextCapture<TransportRequest> forSettings(GatewaySettings settings,
                                                                      SessionPrincipalCache cache,
                                                                      CredentialValidator validator,
                                                                      SensitiveDataRedactor redactor) {
        if (!settings.transport().isNetworked()) {
            return new StdioRequestContextCapture();
        }
        return new HttpRequestContextCapture(settings.authMode(), cache, validator, redactor);
    }
}
