package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.commons.QuerySettings;
import io.sqlbench.eval.runtime.model.PredicateSpec;

import java.sql.Connection;

/**
 * Creates and runs predicates from their specs.
 */
public final class Predicates {

    public static final String RESULT_EQUIVALENCE = "result_equivalence";
    public static final String PLAN_COST = "plan_cost";
    public static final String KEYWORD_USAGE = "keyword_usage";
    public static final String QUERY_RESULT = "query_result";
    public static final String ALL_OF = "all_of";
    public static final String CUSTOM = "custom";

    private Predicates() {
    }

    /**
     * @throws IllegalArgumentException for a missing or unknown type
     */
    public static VerificationPredicate create(PredicateSpec spec) throws ReflectiveOperationException {
        if (spec.type() == null) {
            throw new IllegalArgumentException("Predicate has no type: " + spec.options());
        }
        return switch (spec.type()) {
            case RESULT_EQUIVALENCE -> new ResultEquivalencePredicate();
            case PLAN_COST -> new PlanCostPredicate();
            case KEYWORD_USAGE -> new KeywordUsagePredicate();
            case QUERY_RESULT -> new QueryResultPredicate();
            case ALL_OF -> new AllOfPredicate();
            case CUSTOM -> {
                var className = spec.option(CustomPredicate.CLASS_KEY);
                yield new CustomPredicate(className == null ? null : className.toString());
            }
            default -> throw new IllegalArgumentException("Unknown predicate type: " + spec.type());
        };
    }

    /**
     * Run an already created predicate. The connection may be {@code null} when it needs none.
     */
    public static boolean evaluate(VerificationPredicate predicate,
                                   PredicateSpec spec,
                                   PredicateInput input,
                                   Connection connection,
                                   QuerySettings settings) throws Exception {
        return predicate.test(new PredicateContext(spec, input, connection, settings));
    }
}
