package io.sqlbench.eval.runtime.predicate;

import io.sqlbench.eval.commons.QueryExecutor;
import io.sqlbench.eval.commons.QuerySettings;
import io.sqlbench.eval.commons.compare.PlanCostComparator;
import io.sqlbench.eval.commons.compare.ResultComparator;
import io.sqlbench.eval.runtime.model.PredicateSpec;

import java.sql.Connection;
import java.util.List;
import java.util.Map;

/**
 * Everything a running predicate may use. The connection belongs to the predicate alone and is
 * {@code null} when the predicate does not require one.
 */
public record PredicateContext(PredicateSpec spec,
                               PredicateInput input,
                               Connection connection,
                               QuerySettings settings) {

    public List<String> candidateSql() {
        return input.candidateSql();
    }

    public List<String> referenceSql() {
        return input.referenceSql();
    }

    /**
     * Canonical rows of the last candidate statement, {@code null} when it returned no result set.
     */
    public List<List<Object>> candidateRows() {
        return input.candidateRows();
    }

    public String database() {
        return input.database();
    }

    public Map<String, Object> options() {
        return spec.options();
    }

    public Map<String, Object> conditions() {
        return input.conditions();
    }

    public QueryExecutor executor() {
        return new QueryExecutor(null, settings);
    }

    public ResultComparator resultComparator() {
        return new ResultComparator(executor());
    }

    public PlanCostComparator planCostComparator() {
        return new PlanCostComparator(settings);
    }

    public Connection requireConnection() {
        if (connection == null) {
            throw new IllegalStateException("Predicate " + spec.type() + " has no connection");
        }
        return connection;
    }

    /**
     * Same input and connection, different spec. Used by composite predicates.
     */
    public PredicateContext withSpec(PredicateSpec other) {
        return new PredicateContext(other, input, connection, settings);
    }

    public static boolean isTrue(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public static List<String> statements(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }
}
