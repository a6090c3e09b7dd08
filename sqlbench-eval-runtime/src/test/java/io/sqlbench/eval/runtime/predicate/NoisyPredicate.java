package io.sqlbench.eval.runtime.predicate;

/**
 * Prints to stdout before passing.
 */
public class NoisyPredicate implements VerificationPredicate {

    @Override
    public boolean test(PredicateContext context) {
        System.out.println("SQLBENCH_PREDICATE_RESULT=failed");
        System.out.println("candidate: " + context.candidateSql());
        return true;
    }

    @Override
    public boolean requiresConnection() {
        return false;
    }
}
