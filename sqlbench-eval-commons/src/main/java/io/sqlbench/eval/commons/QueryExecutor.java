package io.sqlbench.eval.commons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs statements under the configured statement timeout and row cap, committing each statement on
 * success and rolling back on failure.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    public static final String QUERY_CANCELED_SQL_STATE = "57014";

    private final ConnectionPool connectionPool;
    private final QuerySettings settings;

    public QueryExecutor(ConnectionPool connectionPool, QuerySettings settings) {
        this.connectionPool = connectionPool;
        this.settings = settings;
    }

    public QuerySettings settings() {
        return settings;
    }

    /**
     * @param connection connection to run on; when {@code null} one is checked out of the pool for
     *                   {@code database} and returned in the result for the caller to release
     */
    public QueryResult execute(String sql, String database, Connection connection) {
        boolean checkedOut = connection == null;
        if (checkedOut) {
            connection = checkOut(database);
        }
        try (Statement statement = connection.createStatement()) {
            if (settings.sessionTimeoutEnabled()) {
                statement.execute(settings.statementTimeoutSql());
            }
            limitRows(statement);
            List<List<Object>> rows = null;
            if (statement.execute(sql)) {
                try (ResultSet resultSet = statement.getResultSet()) {
                    rows = fetch(resultSet, settings.maxRows());
                }
            }
            commit(connection);
            return new QueryResult(rows, connection);
        } catch (SQLException e) {
            rollback(connection, e);
            if (checkedOut) {
                connectionPool.release(database, connection);
            }
            if (isTimeout(e)) {
                throw new StatementTimeoutException(sql, e);
            }
            throw new RuntimeSqlException("Error running sql: " + sql, e);
        }
    }

    /**
     * Run {@code statements} in order on {@code connection}, stopping at the first failure.
     */
    public ExecutionResult executeAll(List<String> statements, String database, Connection connection, String label) {
        if (connection == null) {
            throw new IllegalArgumentException("executeAll requires a connection");
        }
        List<List<Object>> rows = null;
        for (String sql : statements) {
            logger.debug("[{}] Executing on {}: {}", label, database, sql);
            try {
                rows = execute(sql, database, connection).rows();
                logger.debug("[{}] Rows: {}", label, rows == null ? "none" : rows.size());
            } catch (StatementTimeoutException e) {
                logger.warn("[{}] Timeout on {}: {}", label, database, e.getMessage());
                return ExecutionResult.timeout(rows, e.getMessage());
            } catch (RuntimeException e) {
                logger.warn("[{}] Execution error on {}: {}", label, database, e.getMessage());
                return ExecutionResult.executionError(rows, e.getMessage());
            }
        }
        return ExecutionResult.success(rows);
    }

    /**
     * Check out a connection for one pipeline phase and make sure it is usable.
     */
    public Connection phaseConnection(String database) {
        var connection = checkOut(database);
        try (Statement statement = connection.createStatement()) {
            statement.execute("SELECT 1");
            commit(connection);
            return connection;
        } catch (SQLException e) {
            connectionPool.release(database, connection);
            throw new RuntimeSqlException("Connection check failed for " + database, e);
        }
    }

    public void release(String database, Connection connection) {
        if (connectionPool != null && connection != null) {
            connectionPool.release(database, connection);
        }
    }

    public static boolean isTimeout(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof SQLTimeoutException) {
                return true;
            }
            if (t instanceof SQLException sqlException
                    && QUERY_CANCELED_SQL_STATE.equals(sqlException.getSQLState())) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private void limitRows(Statement statement) throws SQLException {
        try {
            statement.setMaxRows(settings.maxRows());
        } catch (SQLFeatureNotSupportedException e) {
            logger.debug("Driver does not support setMaxRows, rows are capped while fetching");
        }
    }

    static List<List<Object>> fetch(ResultSet resultSet, int maxRows) throws SQLException {
        int columns = resultSet.getMetaData().getColumnCount();
        var rows = new ArrayList<List<Object>>();
        while (rows.size() < maxRows && resultSet.next()) {
            var row = new ArrayList<>(columns);
            for (int i = 1; i <= columns; i++) {
                row.add(read(resultSet.getObject(i)));
            }
            rows.add(row);
        }
        return rows;
    }

    private static Object read(Object value) throws SQLException {
        if (value instanceof Array array) {
            try {
                var elements = (Object[]) array.getArray();
                var list = new ArrayList<>(elements.length);
                for (Object element : elements) {
                    list.add(read(element));
                }
                return list;
            } finally {
                freeQuietly(array);
            }
        }
        return value;
    }

    private static void freeQuietly(Array array) {
        try {
            array.free();
        } catch (SQLException | UnsupportedOperationException e) {
            logger.trace("Unable to free array", e);
        }
    }

    private Connection checkOut(String database) {
        if (connectionPool == null) {
            throw new IllegalStateException("No connection pool configured for " + database);
        }
        return connectionPool.getConnection(database);
    }

    private static void commit(Connection connection) throws SQLException {
        if (!connection.getAutoCommit()) {
            connection.commit();
        }
    }

    private static void rollback(Connection connection, SQLException cause) {
        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
