package io.sqlbench.eval.commons.admin;

import io.sqlbench.eval.commons.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Administers databases over a short-lived connection to the maintenance database.
 */
public class JdbcDatabaseAdmin implements DatabaseAdmin {
    private static final Logger logger = LoggerFactory.getLogger(JdbcDatabaseAdmin.class);

    private static final String TERMINATE_SQL =
            "SELECT pg_terminate_backend(pid) FROM pg_stat_activity WHERE datname = ? AND pid <> pg_backend_pid()";

    private final DatabaseConfig config;

    public JdbcDatabaseAdmin(DatabaseConfig config) {
        this.config = config;
    }

    @Override
    public void terminateConnections(String database) {
        try (var connection = open();
             var statement = connection.prepareStatement(TERMINATE_SQL)) {
            statement.setString(1, database);
            statement.execute();
        } catch (SQLException e) {
            throw new DatabaseAdminException("Failed to terminate connections to " + database, e);
        }
    }

    @Override
    public void dropDatabase(String database, boolean ifExists) {
        var sql = "DROP DATABASE " + (ifExists ? "IF EXISTS " : "") + quote(database);
        executeUpdate(sql, "drop " + database);
    }

    @Override
    public void createDatabase(String database, String template) {
        var sql = "CREATE DATABASE " + quote(database) + " TEMPLATE " + quote(template);
        executeUpdate(sql, "create " + database + " from " + template);
    }

    private void executeUpdate(String sql, String description) {
        logger.debug("Executing {}", sql);
        try (var connection = open();
             var statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new DatabaseAdminException("Failed to " + description + ": " + e.getMessage(), e);
        }
    }

    private Connection open() throws SQLException {
        // DROP/CREATE DATABASE cannot run inside a transaction block
        var connection = DriverManager.getConnection(config.jdbcUrl(config.maintenanceDatabase()),
                config.user(), config.password());
        connection.setAutoCommit(true);
        return connection;
    }

    static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}
