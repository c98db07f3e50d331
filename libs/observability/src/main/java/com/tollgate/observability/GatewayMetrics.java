package com.tollgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.ToDoubleFunction;

/**
 * Micrometer meters for the tool gateway and its authentication path.
 * <p>
 * Every meter carries an {@code application} tag. Tool meters are additionally tagged with the
 * tool name and, for counters, the outcome ({@code success}, {@code error}, {@code rejected}).
 * Authentication counters are tagged with the outcome kind reported by the validator.
 * <p>
 * Tool names reaching the meters must come from the registry. Names a caller made up are
 * counted under {@link #UNKNOWN_TOOL} so the tag stays bounded.
 */
public final class GatewayMetrics {

    /** Tag key for the application name. */
    public static final String TAG_APPLICATION = "application";

    /** Tag key for the tool name. */
    public static final String TAG_TOOL = "tool";

    /** Tag key for invocation or authentication outcome. */
    public static final String TAG_OUTCOME = "outcome";

    /** Tool tag value for calls naming a tool that is not registered. */
    public static final String UNKNOWN_TOOL = "unknown";

    public static final String TOOL_INVOCATIONS = "tollgate.tool.invocations";
    public static final String TOOL_DURATION = "tollgate.tool.duration";
    public static final String AUTH_ATTEMPTS = "tollgate.auth.attempts";

    private final MeterRegistry registry;
    private final String application;

    /**
     * @param registry    the Micrometer meter registry
     * @param application application name included as a tag on every meter
     */
    public GatewayMetrics(MeterRegistry registry, String application) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (application == null || application.isBlank()) {
            throw new IllegalArgumentException("application must not be null or blank");
        }
        this.registry = registry;
        this.application = application;
    }

    /**
     * Counts one finished tool invocation.
     */
    public void recordInvocation(String tool, String outcome) {
        Counter.builder(TOOL_INVOCATIONS)
                .description("Tool invocations by outcome")
                .tags(Tags.of(TAG_APPLICATION, application, TAG_TOOL, tool, TAG_OUTCOME, outcome))
                .register(registry)
                .increment();
    }

    /**
     * Timer for handler execution of one tool, including session acquisition and tagging.
     */
    public Timer toolTimer(String tool) {
        return Timer.builder(TOOL_DURATION)
                .description("Tool execution time on the worker pool")
                .tags(Tags.of(TAG_APPLICATION, application, TAG_TOOL, tool))
                .register(registry);
    }

    /**
     * Counts one credential validation attempt.
     */
    public void recordAuthAttempt(String outcome) {
        Counter.builder(AUTH_ATTEMPTS)
                .description("Credential validation attempts by outcome")
                .tags(Tags.of(TAG_APPLICATION, application, TAG_OUTCOME, outcome))
                .register(registry)
                .increment();
    }

    /**
     * Registers a gauge sampling {@code source} through {@code value}. The registry holds the
     * source weakly, so callers keep their own reference.
     */
    public <T> void gauge(String name, String description, T source, ToDoubleFunction<T> value) {
        Gauge.builder(name, source, value)
                .description(description)
                .tags(Tags.of(TAG_APPLICATION, application))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String application() {
        return application;
    }
}
