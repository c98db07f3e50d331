package com.tollgate.gateway;

/**
 * A capability handler: runs one tool against a per-invocation session.
 * <p>
 * The return value becomes the {@code results} of a success envelope, unless it is already a
 * {@link ResponseEnvelope}, in which case it is returned as is.
 *
 * @param <S> the session handle, {@link com.tollgate.database.DataSession} or
 *            {@link java.sql.Connection}
 */
@FunctionalInterface
public interface CapabilityHandler<S> {

    Object handle(S session, ToolArguments arguments) throws Exception;
}
