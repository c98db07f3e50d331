package com.tollgate.database;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;

/**
 * Externalized data-plane connection settings, bound from {@code tollgate.database}.
 *
 * <pre>{@code
 * tollgate:
 *   database:
 *     url: jdbc:teradata://tdhost/DATABASE=dbc
 *     username: svc_tollgate
 *     password: ${TD_PASSWORD}
 *     pool-size: 5
 *     max-overflow: 10
 *     pool-timeout: 30s
 *     login-timeout: 10s
 *     tag-statement: SET QUERY_BAND = '%s' FOR SESSION
 *     bearer-properties:
 *       LOGMECH: JWT
 *       LOGDATA: token=${token}
 * }</pre>
 *
 * A blank {@code url} starts the server without a database; tools then report the connection
 * as unavailable.
 *
 * @param url              JDBC URL of the pooled service connection, nullable
 * @param username         service account user
 * @param password         service account password
 * @param driverClassName  explicit driver class, nullable to let {@code DriverManager} decide
 * @param poolSize         connections kept open
 * @param maxOverflow      extra connections allowed above {@code poolSize} under load
 * @param poolTimeout      how long a caller waits for a pooled connection
 * @param loginTimeout     connect timeout passed to the driver as {@code loginTimeout}
 * @param validationQuery  statement run on a throwaway connection to prove Basic credentials
 * @param identityQuery    statement returning the backend's current user for Bearer credentials
 * @param tagStatement     {@link String#format} template applying a trace tag to a session
 * @param basicProperties  extra driver properties for Basic credential checks
 * @param bearerProperties extra driver properties for Bearer checks; {@code ${token}} is replaced
 */
@Validated
@ConfigurationProperties(prefix = "tollgate.database")
public record DatabaseProperties(
        String url,
        String username,
        String password,
        String driverClassName,
        @Min(1) Integer poolSize,
        @Min(0) Integer maxOverflow,
        Duration poolTimeout,
        Duration loginTimeout,
        @NotBlank String validationQuery,
        @NotBlank String identityQuery,
        @NotBlank String tagStatement,
        Map<String, String> basicProperties,
        Map<String, String> bearerProperties
) {

    public static final String TOKEN_PLACEHOLDER = "${token}";

    public DatabaseProperties {
        if (poolSize == null) {
            poolSize = 5;
        }
        if (maxOverflow == null) {
            maxOverflow = 10;
        }
        if (poolTimeout == null) {
            poolTimeout = Duration.ofSeconds(30);
        }
        if (loginTimeout == null) {
            loginTimeout = Duration.ofSeconds(10);
        }
        if (validationQuery == null || validationQuery.isBlank()) {
            validationQuery = "SELECT 1";
        }
        if (identityQuery == null || identityQuery.isBlank()) {
            identityQuery = "SELECT USER";
        }
        if (tagStatement == null || tagStatement.isBlank()) {
            tagStatement = "SET QUERY_BAND = '%s' FOR SESSION";
        }
        basicProperties = basicProperties == null ? Map.of() : Map.copyOf(basicProperties);
        bearerProperties = bearerProperties == null ? Map.of() : Map.copyOf(bearerProperties);
    }

    /** Properties with only a URL; everything else defaulted. */
    public static DatabaseProperties forUrl(String url, String username, String password) {
        return new DatabaseProperties(url, username, password, null, null, null, null, null,
                null, null, null, null, null);
    }

    public boolean isConfigured() {
        return url != null && !url.isBlank();
    }

    public int maxPoolSize() {
        return poolSize + maxOverflow;
    }

    @Override
    public String toString() {
        return "DatabaseProperties[url=" + url + ", username=" + username + ", password=***, poolSize="
                + poolSize + ", maxOverflow=" + maxOverflow + "]";
    }
}
