package com.tollgate.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Tags a session by executing a templated statement, {@code SET QUERY_BAND = '%s' FOR SESSION}
 * by default. The tag must already be sanitized for a single-quoted literal.
 */
public class StatementSessionTagger implements SessionTagger {

    private final String template;

    public StatementSessionTagger(String template) {
        if (template == null || !template.contains("%s")) {
            throw new IllegalArgumentException("template must contain a %s placeholder");
        }
        this.template = template;
    }

    @Override
    public void apply(Connection connection, String tag) throws SessionTagException {
        String sql = String.format(template, tag);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new SessionTagException("Failed to apply session tag: " + e.getMessage(), e);
        }
    }

    public String template() {
        return template;
    }
}
