package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.commons.compare.ResultNormalizer;
import io.sqlbench.eval.runtime.model.BenchmarkInstance;

import java.util.List;
import java.util.Map;

/**
 * What a predicate sees of the instance it verifies.
 *
 * @param database name of the clone the candidate ran on
 * @param candidateRows canonical rows of the last candidate statement, {@code null} when it returned no result set
 * @param index 1-based position of the predicate within the instance
 */
public record PredicateInput(String instanceId,
                             String database,
                             List<String> candidateSql,
                             List<String> referenceSql,
                             Map<String, Object> conditions,
                             List<List<Object>> candidateRows,
                             int index) {

    public PredicateInput {
        candidateRows = ResultNormalizer.normalizeRows(candidateRows);
    }

    public static PredicateInput of(BenchmarkInstance instance, String database, List<List<Object>> candidateRows, int index) {
        return new PredicateInput(instance.instanceId(), database, instance.candidateSql(),
                instance.referenceSql(), instance.conditions(), candidateRows, index);
    }
}
