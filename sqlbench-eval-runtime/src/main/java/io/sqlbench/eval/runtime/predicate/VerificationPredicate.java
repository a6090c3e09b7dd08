package io.sqlbench.eval.runtime.predicate;

/**
 * A check run after the candidate statements. Returning false or throwing means the check failed.
 * Implementations named by class in a {@code custom} predicate need a public no-arg constructor.
 */
public interface VerificationPredicate {

    boolean test(PredicateContext context) throws Exception;

    /**
     * Whether {@link PredicateContext#connection()} must be open when {@link #test} runs.
     */
    default boolean requiresConnection() {
        return true;
    }
}
