package com.tollgate.security.capture;

import com.tollgate.observability.RequestContext;
import com.tollgate.security.AuthenticationException;

/**
 * Builds the {@link RequestContext} for one inbound message. One strategy exists per
 * transport shape, chosen once at startup.
 *
 * @param <T> the transport's request representation
 */
public interface RequestContextCapture<T> {

    /**
     * @throws AuthenticationException when the request must be refused
     */
    RequestContext capture(T request);
}
