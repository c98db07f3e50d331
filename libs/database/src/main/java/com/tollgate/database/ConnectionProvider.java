package com.tollgate.database;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of data-plane sessions. Sessions are per-invocation and never shared.
 */
public interface ConnectionProvider extends AutoCloseable {

    /**
     * @return true if a live connection resource exists
     */
    boolean isAvailable();

    /**
     * Discards the current resource, if any, and builds a new one.
     */
    void reconnect();

    DataSession openSession() throws SQLException;

    Connection openRawConnection() throws SQLException;

    @Override
    void close();
}
