package io.sqlbench.eval.commons.pool;

public class NoEphemeralDatabaseException extends RuntimeException {
    public NoEphemeralDatabaseException(String message) {
        super(message);
    }
}
