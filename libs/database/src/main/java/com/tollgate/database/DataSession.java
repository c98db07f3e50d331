package com.tollgate.database;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * A managed session over one pooled connection, scoped to a single tool invocation.
 * Closing the session returns the connection to the pool.
 */
public class DataSession implements AutoCloseable {

    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;

    public DataSession(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        this.connection = connection;
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    /**
     * Runs a query and returns each row as a column-name to value map, in column order.
     */
    public List<Map<String, Object>> queryForList(String sql, Object... args) {
        if (args == null || args.length == 0) {
            return jdbcTemplate.queryForList(sql);
        }
        return jdbcTemplate.queryForList(sql, args);
    }

    public void execute(String sql) {
        jdbcTemplate.execute(sql);
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public Connection connection() {
        return connection;
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
