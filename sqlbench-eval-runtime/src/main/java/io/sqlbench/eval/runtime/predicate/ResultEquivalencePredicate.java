package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.commons.compare.SqlNormalizer;
import io.sqlbench.eval.runtime.model.BenchmarkInstance;

/**
 * Candidate and reference return the same canonical rows. Row order counts only when the
 * {@code order} option, or the instance condition of that name, is true.
 */
public class ResultEquivalencePredicate implements VerificationPredicate {

    @Override
    public boolean test(PredicateContext context) {
        var order = context.spec().hasOption(BenchmarkInstance.ORDER)
                ? context.spec().option(BenchmarkInstance.ORDER)
                : context.conditions().get(BenchmarkInstance.ORDER);
        return context.resultComparator().compareResults(
                SqlNormalizer.normalize(context.candidateSql()),
                SqlNormalizer.normalize(context.referenceSql()),
                context.database(),
                context.requireConnection(),
                PredicateContext.isTrue(order));
    }
}
