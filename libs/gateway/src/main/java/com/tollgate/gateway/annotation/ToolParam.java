package com.tollgate.gateway.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A caller-supplied argument of a {@link Tool} method.
 */
@Documented
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface ToolParam {

    /** Argument name as seen by clients. */
    String value();

    String description() default "";

    boolean required() default true;

    /** Default applied when the argument is absent; empty means none. Implies not required. */
    String defaultValue() default "";
}
