package io.sqlbench.eval.commons.admin;

/**
 * A database could not be dropped, created or disconnected. Not recoverable at instance level.
 */
public class DatabaseAdminException extends RuntimeException {
    public DatabaseAdminException(String message) {
        super(message);
    }

    public DatabaseAdminException(String message, Throwable cause) {
        super(message, cause);
    }
}
