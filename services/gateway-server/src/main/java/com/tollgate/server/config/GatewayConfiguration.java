package com.tollgate.server.config;

import com.tollgate.database.ConnectionProvider;
import com.tollgate.database.DatabaseProperties;
import com.tollgate.database.JdbcCredentialVerifier;
import com.tollgate.database.PooledConnectionProvider;
import com.tollgate.database.SessionTagger;
import com.tollgate.database.StatementSessionTagger;
import com.tollgate.gateway.ToolInvocationGateway;
import com.tollgate.gateway.ToolRegistry;
import com.tollgate.observability.GatewayMetrics;
import com.tollgate.observability.SensitiveDataRedactor;
import com.tollgate.observability.SpanHelper;
import com.tollgate.security.CredentialValidator;
import com.tollgate.security.CredentialVerifier;
import com.tollgate.security.GatewaySettings;
import com.tollgate.security.RateLimiter;
import com.tollgate.security.SessionPrincipalCache;
import com.tollgate.security.capture.RequestContextCapture;
import com.tollgate.security.capture.RequestContextCaptures;
import com.tollgate.security.capture.TransportRequest;
import com.tollgate.server.tools.ToolProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the gateway libraries into the application context. The libraries carry no Spring
 * annotations; every collaborator is created here.
 */
@Configuration
public class GatewayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfiguration.class);

    /** Injectable key under which handlers receive the process {@link GatewaySettings}. */
    public static final String SETTINGS_INJECTABLE = "gateway_settings";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GatewaySettings gatewaySettings(GatewayProperties properties) {
        GatewaySettings settings = properties.toSettings();
        log.info("Gateway settings: transport={}, auth={}, profile={}",
                settings.transport().value(), settings.authMode().value(), settings.profile());
        return settings;
    }

    @Bean
    public GatewayMetrics gatewayMetrics(MeterRegistry meterRegistry, GatewaySettings settings) {
        return new GatewayMetrics(meterRegistry, settings.applicationName());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("tollgate"));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public SessionPrincipalCache sessionPrincipalCache(GatewaySettings settings, Clock clock) {
        return new SessionPrincipalCache(settings.cacheTtl(), clock);
    }

    @Bean
    public RateLimiter rateLimiter(GatewaySettings settings, Clock clock) {
        return new RateLimiter(settings.rateLimitAttempts(), settings.rateLimitWindow(), clock);
    }

    @Bean(destroyMethod = "close")
    public ConnectionProvider connectionProvider(DatabaseProperties databaseProperties) {
        return new PooledConnectionProvider(databaseProperties);
    }

    @Bean
    public CredentialVerifier credentialVerifier(DatabaseProperties databaseProperties) {
        return new JdbcCredentialVerifier(databaseProperties);
    }

    @Bean
    public CredentialValidator credentialValidator(RateLimiter rateLimiter, CredentialVerifier verifier,
                                                   GatewayMetrics metrics) {
        return new CredentialValidator(rateLimiter, verifier, metrics);
    }

    @Bean
    public RequestContextCapture<TransportRequest> requestContextCapture(GatewaySettings settings,
                                                                         SessionPrincipalCache cache,
                                                                         CredentialValidator validator,
                                                                         SensitiveDataRedactor redactor) {
        return RequestContextCaptures.forSettings(settings, cache, validator, redactor);
    }

    @Bean
    public SessionTagger sessionTagger(DatabaseProperties databaseProperties) {
        return new StatementSessionTagger(databaseProperties.tagStatement());
    }

    @Bean
    public ThreadPoolTaskExecutor toolExecutor(GatewayProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.workerThreads());
        executor.setMaxPoolSize(properties.workerThreads());
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix("tool-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public ToolRegistry toolRegistry(ApplicationContext applicationContext) {
        ToolRegistry registry = new ToolRegistry();
        for (Object provider : applicationContext.getBeansWithAnnotation(ToolProvider.class).values()) {
            registry.registerAnnotated(provider);
        }
        log.info("Registered {} tools", registry.size());
        return registry;
    }

    @Bean
    public ToolInvocationGateway toolInvocationGateway(ToolRegistry registry, ConnectionProvider connectionProvider,
                                                       SessionTagger sessionTagger, GatewaySettings settings,
                                                       @Qualifier("toolExecutor") Executor toolExecutor,
                                                       GatewayMetrics metrics, SpanHelper spanHelper) {
        return new ToolInvocationGateway(registry, connectionProvider, sessionTagger, settings,
                Map.of(SETTINGS_INJECTABLE, settings), toolExecutor, metrics, spanHelper);
    }
}
