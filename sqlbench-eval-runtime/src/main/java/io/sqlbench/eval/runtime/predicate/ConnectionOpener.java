package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.commons.DatabaseConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens a dedicated connection for one predicate. The caller closes it.
 */
@FunctionalInterface
public interface ConnectionOpener {

    Connection open(String database) throws SQLException;

    static ConnectionOpener of(DatabaseConfig config) {
        return database -> {
            var connection = DriverManager.getConnection(config.jdbcUrl(database), config.user(), config.password());
            connection.setAutoCommit(false);
            return connection;
        };
    }
}
