package com.tollgate.gateway;

import com.tollgate.database.DataSession;

import java.sql.Connection;

/**
 * A descriptor paired with its handler.
 */
public final class RegisteredTool {

    private final ToolDescriptor descriptor;
    private final CapabilityHandler<DataSession> managedHandler;
    private final CapabilityHandler<Connection> rawHandler;

    private RegisteredTool(ToolDescriptor descriptor, CapabilityHandler<DataSession> managedHandler,
                           CapabilityHandler<Connection> rawHandler) {
        this.descriptor = descriptor;
        this.managedHandler = managedHandler;
        this.rawHandler = rawHandler;
    }

    static RegisteredTool managed(ToolDescriptor descriptor, CapabilityHandler<DataSession> handler) {
        return new RegisteredTool(descriptor, handler, null);
    }

    static RegisteredTool raw(ToolDescriptor descriptor, CapabilityHandler<Connection> handler) {
        return new RegisteredTool(descriptor, null, handler);
    }

    public ToolDescriptor descriptor() {
        return descriptor;
    }

    public String name() {
        return descriptor.name();
    }

    Object invoke(DataSession session, ToolArguments arguments) throws Exception {
        return managedHandler.handle(session, arguments);
    }

    Object invoke(Connection connection, ToolArguments arguments) throws Exception {
        return rawHandler.handle(connection, arguments);
    }
}
