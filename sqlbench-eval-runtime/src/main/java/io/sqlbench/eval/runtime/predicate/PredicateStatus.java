package io.sqlbench.eval.runtime.predicate;

public enum PredicateStatus {
    PASSED,
    FAILED,
    TIMEOUT
}
