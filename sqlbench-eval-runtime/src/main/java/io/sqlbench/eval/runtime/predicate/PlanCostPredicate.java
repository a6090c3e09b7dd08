package io.sqlbench.eval.runtime.predicate;

/**
 * The candidate is estimated cheaper than the {@code baseline} statements, the reference by default.
 */
public class PlanCostPredicate implements VerificationPredicate {

    public static final String BASELINE = "baseline";

    @Override
    public boolean test(PredicateContext context) {
        var baseline = context.spec().hasOption(BASELINE)
                ? PredicateContext.statements(context.spec().option(BASELINE))
                : context.referenceSql();
        return context.planCostComparator().compareCost(baseline, context.candidateSql(), context.requireConnection());
    }
}
