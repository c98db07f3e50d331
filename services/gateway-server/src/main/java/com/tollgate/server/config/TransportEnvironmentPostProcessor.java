package com.tollgate.server.config;

import com.tollgate.security.TransportKind;
import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Adjusts the application for the stdio transport before the context starts: no servlet
 * container, no banner, console logging on stderr. Stdout carries protocol messages only.
 */
public class TransportEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "tollgateTransport";
    static final String TRANSPORT_PROPERTY = "tollgate.gateway.transport";
    static final String CONSOLE_TARGET_PROPERTY = "tollgate.logging.console-target";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        TransportKind transport = TransportKind.parse(environment.getProperty(TRANSPORT_PROPERTY));
        if (transport.isNetworked()) {
            return;
        }
        environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(
                "spring.main.web-application-type", "none",
                "spring.main.banner-mode", "off",
                CONSOLE_TARGET_PROPERTY, "System.err")));
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
