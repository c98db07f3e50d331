package com.tollgate.server.infrastructure.stdio;

import io.modelcontextprotocol.server.McpAsyncServer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Keeps a stdio process alive until stdin closes, then shuts the MCP server down so the
 * application can exit.
 */
@Component
@ConditionalOnProperty(prefix = "tollgate.gateway", name = "transport", havingValue = "stdio", matchIfMissing = true)
public class StdioServerRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StdioServerRunner.class);

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final EndOfInputLatch stdin;
    private final McpAsyncServer server;

    public StdioServerRunner(EndOfInputLatch stdin, McpAsyncServer server) {
        this.stdin = stdin;
        this.server = server;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        log.info("Serving MCP over stdio");
        stdin.await();
        log.info("stdin closed");
        try {
            server.closeGracefully().block(SHUTDOWN_TIMEOUT);
        } catch (RuntimeException e) {
            log.warn("MCP server did not close within {}: {}", SHUTDOWN_TIMEOUT, e.getMessage());
        }
    }
}
