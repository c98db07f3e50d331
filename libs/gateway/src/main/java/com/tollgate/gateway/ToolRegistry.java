package com.tollgate.gateway;

import com.tollgate.database.DataSession;
import com.tollgate.database.SessionKind;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of tools a server exposes. Built at startup and passed explicitly to the gateway;
 * iteration order is registration order.
 */
public class ToolRegistry {

    private final Map<String, RegisteredTool> tools = new LinkedHashMap<>();

    public synchronized ToolRegistry registerManaged(ToolDescriptor descriptor, CapabilityHandler<DataSession> handler) {
        requireKind(descriptor, handler, SessionKind.MANAGED);
        return add(RegisteredTool.managed(descriptor, handler));
    }

    public synchronized ToolRegistry registerRaw(ToolDescriptor descriptor, CapabilityHandler<Connection> handler) {
        requireKind(descriptor, handler, SessionKind.RAW);
        return add(RegisteredTool.raw(descriptor, handler));
    }

    /**
     * Registers every {@link com.tollgate.gateway.annotation.Tool} method of {@code bean}.
     *
     * @throws IllegalStateException if a method signature cannot be adapted or a name is taken
     */
    public synchronized ToolRegistry registerAnnotated(Object bean) {
        for (RegisteredTool tool : AnnotatedToolScanner.scan(bean)) {
            add(tool);
        }
        return this;
    }

    public synchronized Optional<RegisteredTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized List<ToolDescriptor> descriptors() {
        List<ToolDescriptor> result = new ArrayList<>(tools.size());
        tools.values().forEach(tool -> result.add(tool.descriptor()));
        return result;
    }

    public synchronized int size() {
        return tools.size();
    }

    private ToolRegistry add(RegisteredTool tool) {
        if (tools.containsKey(tool.name())) {
            throw new IllegalStateException("Tool already registered: " + tool.name());
        }
        tools.put(tool.name(), tool);
        return this;
    }

    private static void requireKind(ToolDescriptor descriptor, CapabilityHandler<?> handler, SessionKind expected) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        if (descriptor.sessionKind() != expected) {
            throw new IllegalArgumentException("Tool " + descriptor.name() + " declares "
                    + descriptor.sessionKind() + " but was registered as " + expected);
        }
    }
}
