package io.sqlbench.eval.commons;

import java.sql.SQLException;

/**
 * Thrown when a statement is cancelled by the server-side statement timeout.
 */
public class StatementTimeoutException extends RuntimeSqlException {
    public StatementTimeoutException(String sql, SQLException sqlException) {
        super("Statement timed out: " + sql, sqlException);
    }
}
