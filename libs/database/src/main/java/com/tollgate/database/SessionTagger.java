package com.tollgate.database;

import java.sql.Connection;

/**
 * Applies a diagnostic trace tag to a data-plane session so that backend audit logs can
 * attribute the work to the originating request.
 */
@FunctionalInterface
public interface SessionTagger {

    void apply(Connection connection, String tag) throws SessionTagException;
}
