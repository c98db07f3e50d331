package com.tollgate.database;

import com.tollgate.security.CredentialVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Proves credentials by opening a throwaway, unpooled JDBC connection with them.
 * <p>
 * Basic credentials connect as the user and run the validation query. Bearer tokens connect
 * with the configured bearer properties (for Teradata {@code LOGMECH=JWT},
 * {@code LOGDATA=token=...}) and read back the current user with the identity query.
 * <p>
 * A refused login returns false / empty. Connection-class failures (SQLState {@code 08xxx})
 * mean the database could not be reached and are rethrown unchecked.
 */
public class JdbcCredentialVerifier implements CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(JdbcCredentialVerifier.class);

    /**
     * Opens a JDBC connection; {@link DriverManager#getConnection(String, Properties)} in
     * production.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection connect(String url, Properties properties) throws SQLException;
    }

    private final DatabaseProperties properties;
    private final ConnectionFactory connectionFactory;

    public JdbcCredentialVerifier(DatabaseProperties properties) {
        this(properties, DriverManager::getConnection);
    }

    public JdbcCredentialVerifier(DatabaseProperties properties, ConnectionFactory connectionFactory) {
        if (properties == null) {
            throw new IllegalArgumentException("properties must not be null");
        }
        if (connectionFactory == null) {
            throw new IllegalArgumentException("connectionFactory must not be null");
        }
        this.properties = properties;
        this.connectionFactory = connectionFactory;
    }

    @Override
    public boolean verifyBasic(String username, String secret) {
        Properties connectProperties = baseProperties(properties.basicProperties(), null);
        connectProperties.setProperty("user", username);
        connectProperties.setProperty("password", secret);
        try (Connection connection = connectionFactory.connect(properties.url(), connectProperties);
             Statement statement = connection.createStatement()) {
            statement.execute(properties.validationQuery());
            return true;
        } catch (SQLException e) {
            return refusedOrRethrow(e, "Basic");
        }
    }

    @Override
    public Optional<String> resolveBearerIdentity(String token) {
        Properties connectProperties = baseProperties(properties.bearerProperties(), token);
        try (Connection connection = connectionFactory.connect(properties.url(), connectProperties);
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(properties.identityQuery())) {
            if (!rs.next()) {
                return Optional.empty();
            }
            String identity = rs.getString(1);
            return identity == null || identity.isBlank() ? Optional.empty() : Optional.of(identity.strip());
        } catch (SQLException e) {
            refusedOrRethrow(e, "Bearer");
            return Optional.empty();
        }
    }

    private Properties baseProperties(Map<String, String> extra, String token) {
        Properties connectProperties = new Properties();
        connectProperties.setProperty("loginTimeout", String.valueOf(properties.loginTimeout().toSeconds()));
        extra.forEach((key, value) -> connectProperties.setProperty(key,
                token == null ? value : value.replace(DatabaseProperties.TOKEN_PLACEHOLDER, token)));
        return connectProperties;
    }

    private boolean refusedOrRethrow(SQLException e, String scheme) {
        String state = e.getSQLState();
        if (state != null && state.startsWith("08")) {
            throw new IllegalStateException("Database unreachable during " + scheme + " verification", e);
        }
        log.debug("{} credentials refused by database: {}", scheme, e.getMessage());
        return false;
    }
}
