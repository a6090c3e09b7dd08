package io.sqlbench.eval.commons;

import java.util.List;

/**
 * Result of a statement sequence. {@code rows} holds the result of the last statement that ran.
 */
public record ExecutionResult(List<List<Object>> rows,
                              boolean executionError,
                              boolean timeoutError,
                              String errorMessage) {

    public static ExecutionResult success(List<List<Object>> rows) {
        return new ExecutionResult(rows, false, false, null);
    }

    public static ExecutionResult executionError(List<List<Object>> rows, String message) {
        return new ExecutionResult(rows, true, false, message);
    }

    public static ExecutionResult timeout(List<List<Object>> rows, String message) {
        return new ExecutionResult(rows, false, true, message);
    }

    public boolean failed() {
        return executionError || timeoutError;
    }
}
