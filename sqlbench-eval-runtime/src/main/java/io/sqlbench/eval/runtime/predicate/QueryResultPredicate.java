package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.commons.compare.ResultComparator;
import io.sqlbench.eval.commons.compare.ResultNormalizer;
import io.sqlbench.eval.runtime.model.BenchmarkInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The {@code sql} statements, run against the state the candidate left behind, return the
 * {@code expected} rows. Without {@code sql} the candidate's own result is checked.
 */
public class QueryResultPredicate implements VerificationPredicate {
    private static final Logger logger = LoggerFactory.getLogger(QueryResultPredicate.class);

    public static final String SQL = "sql";
    public static final String EXPECTED = "expected";

    @Override
    public boolean test(PredicateContext context) {
        var actual = actualRows(context);
        var expected = ResultNormalizer.normalizeRows(expectedRows(context.spec().option(EXPECTED)));
        var order = PredicateContext.isTrue(context.spec().option(BenchmarkInstance.ORDER));
        var matches = ResultComparator.matches(actual, expected, order);
        if (!matches) {
            logger.info("Expected {} but got {}", expected, actual);
        }
        return matches;
    }

    private static List<List<Object>> actualRows(PredicateContext context) {
        var statements = PredicateContext.statements(context.spec().option(SQL));
        if (statements.isEmpty()) {
            var candidateRows = context.candidateRows();
            if (candidateRows == null) {
                throw new PredicateFailure("Candidate returned no result set");
            }
            return candidateRows;
        }
        var result = context.executor().executeAll(statements, context.database(), context.requireConnection(), "predicate");
        if (result.failed()) {
            throw new PredicateFailure("Verification query failed: " + result.errorMessage());
        }
        return ResultNormalizer.normalizeRows(result.rows() == null ? List.of() : result.rows());
    }

    private static List<List<Object>> expectedRows(Object value) {
        var rows = new ArrayList<List<Object>>();
        if (value instanceof List<?> list) {
            for (Object row : list) {
                if (row instanceof List<?> columns) {
                    rows.add(new ArrayList<>(columns));
                } else {
                    rows.add(Collections.singletonList(row));
                }
            }
        }
        return rows;
    }
}
