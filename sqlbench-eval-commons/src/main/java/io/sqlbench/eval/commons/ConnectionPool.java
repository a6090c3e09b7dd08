package io.sqlbench.eval.commons;

import java.io.Closeable;
import java.sql.Connection;

/**
 * Per-database pools of live connections. A connection is checked out for a phase and checked back
 * in by the caller that owns it.
 */
public interface ConnectionPool extends Closeable {

    Connection getConnection(String database);

    void release(String database, Connection connection);

    /**
     * Close the pool of one database. The next {@link #getConnection(String)} creates a new one.
     */
    void close(String database);

    @Override
    void close();
}
