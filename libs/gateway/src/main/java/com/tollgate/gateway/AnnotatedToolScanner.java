package com.tollgate.gateway;

import com.tollgate.database.DataSession;
import com.tollgate.database.SessionKind;
import com.tollgate.gateway.annotation.Injected;
import com.tollgate.gateway.annotation.Tool;
import com.tollgate.gateway.annotation.ToolName;
import com.tollgate.gateway.annotation.ToolParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds {@link RegisteredTool}s from the {@link Tool} methods of a bean.
 * <p>
 * Method signatures are read once here; each invocation only maps the already-bound
 * {@link ToolArguments} onto the method's parameter positions.
 */
final class AnnotatedToolScanner {

    private static final Logger log = LoggerFactory.getLogger(AnnotatedToolScanner.class);

    private AnnotatedToolScanner() {
        // utility class
    }

    static List<RegisteredTool> scan(Object bean) {
        List<Method> methods = new ArrayList<>();
        for (Method method : bean.getClass().getMethods()) {
            if (method.isAnnotationPresent(Tool.class)) {
                methods.add(method);
            }
        }
        methods.sort(Comparator.comparing(Method::getName));

        List<RegisteredTool> tools = new ArrayList<>();
        for (Method method : methods) {
            tools.add(register(bean, method));
        }
        return tools;
    }

    private static RegisteredTool register(Object bean, Method method) {
        Tool tool = method.getAnnotation(Tool.class);
        String name = tool.name().isEmpty() ? method.getName() : tool.name();
        Parameter[] params = method.getParameters();
        if (params.length == 0) {
            throw new IllegalStateException("Tool method " + method.getName() + " must take a session first");
        }

        SessionKind kind;
        if (DataSession.class.equals(params[0].getType())) {
            kind = SessionKind.MANAGED;
        } else if (Connection.class.equals(params[0].getType())) {
            kind = SessionKind.RAW;
        } else {
            throw new IllegalStateException("First parameter of tool method " + method.getName()
                    + " must be DataSession or Connection");
        }

        ToolDescriptor.Builder builder = ToolDescriptor.builder(name)
                .description(tool.description())
                .sessionKind(kind);
        List<ToolParameter> parameters = new ArrayList<>();
        for (int i = 1; i < params.length; i++) {
            ToolParameter parameter = describe(method, params[i]);
            parameters.add(parameter);
            builder.parameter(parameter);
        }
        ToolDescriptor descriptor = builder.build();
        Class<?>[] javaTypes = method.getParameterTypes();

        log.debug("Registered tool {} ({} session, {} parameters)", name, kind, parameters.size());
        if (kind == SessionKind.MANAGED) {
            return RegisteredTool.managed(descriptor,
                    (session, args) -> call(bean, method, session, parameters, javaTypes, args));
        }
        return RegisteredTool.raw(descriptor,
                (connection, args) -> call(bean, method, connection, parameters, javaTypes, args));
    }

    private static ToolParameter describe(Method method, Parameter param) {
        if (param.isAnnotationPresent(ToolName.class)) {
            if (!String.class.equals(param.getType())) {
                throw new IllegalStateException("@ToolName parameter of " + method.getName() + " must be a String");
            }
            return ToolParameter.toolName("tool_name");
        }
        Injected injected = param.getAnnotation(Injected.class);
        if (injected != null) {
            return ToolParameter.injected(injected.value());
        }
        ToolParam toolParam = param.getAnnotation(ToolParam.class);
        if (toolParam == null) {
            throw new IllegalStateException("Parameter " + param.getName() + " of tool method " + method.getName()
                    + " needs @ToolParam, @ToolName or @Injected");
        }
        ParameterType type = ParameterType.forJavaType(param.getType());
        Object defaultValue = toolParam.defaultValue().isEmpty() ? null : toolParam.defaultValue();
        return new ToolParameter(toolParam.value(), type, toolParam.description(),
                toolParam.required(), defaultValue, ParameterRole.VISIBLE);
    }

    private static Object call(Object bean, Method method, Object session, List<ToolParameter> parameters,
                               Class<?>[] javaTypes, ToolArguments args) throws Exception {
        Object[] values = new Object[parameters.size() + 1];
        values[0] = session;
        for (int i = 0; i < parameters.size(); i++) {
            ToolParameter parameter = parameters.get(i);
            Object value;
            switch (parameter.role()) {
                case TOOL_NAME:
                    value = args.toolName();
                    break;
                case INJECTED:
                    value = args.injected(parameter.name());
                    break;
                default:
                    value = args.get(parameter.name());
                    break;
            }
            values[i + 1] = ArgumentBinder.toJavaType(value, javaTypes[i + 1]);
        }
        try {
            return method.invoke(bean, values);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
