package io.sqlbench.eval.commons.compare;

import io.sqlbench.eval.commons.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.HashSet;
import java.util.List;

public class ResultComparator {
    private static final Logger logger = LoggerFactory.getLogger(ResultComparator.class);

    private final QueryExecutor executor;

    public ResultComparator(QueryExecutor executor) {
        this.executor = executor;
    }

    /**
     * Run both statement lists on {@code connection} and compare the canonical result of their last
     * statements. An error, a timeout or an empty result on either side is a mismatch.
     */
    public boolean compareResults(List<String> candidate,
                                  List<String> reference,
                                  String database,
                                  Connection connection,
                                  boolean orderMatters) {
        var candidateResult = executor.executeAll(candidate, database, connection, "candidate");
        if (candidateResult.failed()) {
            logger.info("Candidate failed on {}: {}", database, candidateResult.errorMessage());
            return false;
        }
        var referenceResult = executor.executeAll(reference, database, connection, "reference");
        if (referenceResult.failed()) {
            logger.info("Reference failed on {}: {}", database, referenceResult.errorMessage());
            return false;
        }
        var candidateRows = candidateResult.rows();
        var referenceRows = referenceResult.rows();
        if (candidateRows == null || referenceRows == null || candidateRows.isEmpty() || referenceRows.isEmpty()) {
            logger.info("Empty result on {}, treated as mismatch", database);
            return false;
        }
        return matches(ResultNormalizer.normalizeRows(candidateRows),
                ResultNormalizer.normalizeRows(referenceRows),
                orderMatters);
    }

    /**
     * Unordered comparison is set based: duplicate rows collapse, so {@code [a, a, b]} matches
     * {@code [a, b]}.
     */
    public static boolean matches(List<List<Object>> candidate, List<List<Object>> reference, boolean orderMatters) {
        if (orderMatters) {
            return candidate.equals(reference);
        }
        return new HashSet<>(candidate).equals(new HashSet<>(reference));
    }
}
