package com.tollgate.server;

import com.tollgate.database.DatabaseProperties;
import com.tollgate.security.GatewaySettings;
import com.tollgate.server.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Tollgate gateway server.
 * <p>
 * Runs one MCP transport per process, chosen by {@code tollgate.gateway.transport}. Streamable
 * HTTP and SSE start the embedded servlet container. Stdio runs as a non-web application that
 * serves stdin until it closes and then exits.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties({GatewayProperties.class, DatabaseProperties.class})
@EnableScheduling
public class TollgateApplication {

    private static final Logger log = LoggerFactory.getLogger(TollgateApplication.class);

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(TollgateApplication.class, args);
        GatewaySettings settings = context.getBean(GatewaySettings.class);
        if (!settings.transport().isNetworked()) {
            log.info("stdin closed; shutting down");
            System.exit(SpringApplication.exit(context));
        }
        log.info("Tollgate started on {} transport", settings.transport().value());
    }
}
