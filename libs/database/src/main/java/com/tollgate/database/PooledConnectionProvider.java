package com.tollgate.database;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.jdbc.DataSourceBuilder;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ConnectionProvider} backed by a HikariCP pool built from {@link DatabaseProperties}.
 * <p>
 * The pool is created lazily: no connection is attempted until the first session is requested,
 * so the server starts even while the database is unreachable. The pool holds
 * {@code poolSize} idle connections and grows to {@code poolSize + maxOverflow}.
 */
public class PooledConnectionProvider implements ConnectionProvider {

    private static final Logger log = LoggerFactory.getLogger(PooledConnectionProvider.class);

    static final String POOL_NAME = "tollgate-pool";

    private final DatabaseProperties properties;
    private final AtomicReference<HikariDataSource> pool = new AtomicReference<>();

    public PooledConnectionProvider(DatabaseProperties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties must not be null");
        }
        this.properties = properties;
        pool.set(createPool());
    }

    @Override
    public boolean isAvailable() {
        HikariDataSource current = pool.get();
        return current != null && !current.isClosed();
    }

    @Override
    public synchronized void reconnect() {
        log.info("Rebuilding database connection pool");
        HikariDataSource replacement = createPool();
        HikariDataSource previous = pool.getAndSet(replacement);
        if (previous != null) {
            previous.close();
        }
    }

    @Override
    public DataSession openSession() throws SQLException {
        return new DataSession(openRawConnection());
    }

    @Override
    public Connection openRawConnection() throws SQLException {
        HikariDataSource current = pool.get();
        if (current == null || current.isClosed()) {
            throw new SQLException("No database connection available");
        }
        return current.getConnection();
    }

    @Override
    public synchronized void close() {
        HikariDataSource current = pool.getAndSet(null);
        if (current != null) {
            current.close();
            log.info("Database connection pool closed");
        }
    }

    HikariDataSource pool() {
        return pool.get();
    }

    private HikariDataSource createPool() {
        if (!properties.isConfigured()) {
            log.warn("No database URL configured; tools requiring a connection will fail");
            return null;
        }
        DataSourceBuilder<HikariDataSource> builder = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(properties.url())
                .username(properties.username())
                .password(properties.password());
        if (properties.driverClassName() != null && !properties.driverClassName().isBlank()) {
            builder.driverClassName(properties.driverClassName());
        }
        HikariDataSource dataSource = builder.build();
        dataSource.setPoolName(POOL_NAME);
        dataSource.setMinimumIdle(properties.poolSize());
        dataSource.setMaximumPoolSize(properties.maxPoolSize());
        dataSource.setConnectionTimeout(properties.poolTimeout().toMillis());
        dataSource.setInitializationFailTimeout(-1);
        dataSource.addDataSourceProperty("loginTimeout", String.valueOf(properties.loginTimeout().toSeconds()));
        log.info("Configured connection pool for {} (size {}, overflow {})",
                properties.url(), properties.poolSize(), properties.maxOverflow());
        return dataSource;
    }
}
