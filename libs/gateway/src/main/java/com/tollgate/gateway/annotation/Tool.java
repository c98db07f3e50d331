package com.tollgate.gateway.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a capability handler. The first parameter must be a
 * {@link com.tollgate.database.DataSession} or a {@link java.sql.Connection}; every other
 * parameter carries {@link ToolParam}, {@link ToolName} or {@link Injected}.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Tool {

    /** Tool name; defaults to the method name. */
    String name() default "";

    String description() default "";
}
