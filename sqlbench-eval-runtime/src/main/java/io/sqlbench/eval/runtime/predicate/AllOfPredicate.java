package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.runtime.model.PredicateSpec;

/**
 * Every spec of the {@code predicates} option passes. Stops at the first failure.
 */
public class AllOfPredicate implements VerificationPredicate {

    public static final String PREDICATES = "predicates";

    @Override
    public boolean test(PredicateContext context) throws Exception {
        var nested = context.spec().listOption(PREDICATES);
        if (nested.isEmpty()) {
            throw new PredicateFailure("all_of requires the predicates option");
        }
        for (Object value : nested) {
            var spec = PredicateSpec.fromObject(value);
            if (!Predicates.create(spec).test(context.withSpec(spec))) {
                return false;
            }
        }
        return true;
    }
}
