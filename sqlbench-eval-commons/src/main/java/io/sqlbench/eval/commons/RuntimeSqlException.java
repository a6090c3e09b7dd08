package io.sqlbench.eval.commons;

import java.sql.SQLException;

public class RuntimeSqlException extends RuntimeException {
    final SQLException sqlException;

    public RuntimeSqlException(SQLException sqlException) {
        super(sqlException);
        this.sqlException = sqlException;
    }

    public RuntimeSqlException(String message, SQLException sqlException) {
        super(message + ": " + sqlException.getMessage(), sqlException);
        this.sqlException = sqlException;
    }

    public SQLException getSqlException() {
        return sqlException;
    }

    public String getSqlState() {
        return sqlException.getSQLState();
    }
}
