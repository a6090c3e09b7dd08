package io.sqlbench.eval.runtime.predicate;

/**
 * Thrown by a predicate whose assertion does not hold.
 */
public class PredicateFailure extends RuntimeException {
    public PredicateFailure(String message) {
        super(message);
    }
}
