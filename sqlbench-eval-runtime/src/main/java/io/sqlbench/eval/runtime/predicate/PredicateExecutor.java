package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.runtime.model.PredicateSpec;

import java.io.Closeable;

/**
 * Runs one predicate in isolation under a wall-clock budget. Never retries.
 */
public interface PredicateExecutor extends Closeable {

    PredicateStatus execute(PredicateSpec spec, PredicateInput input);

    @Override
    default void close() {
    }
}
