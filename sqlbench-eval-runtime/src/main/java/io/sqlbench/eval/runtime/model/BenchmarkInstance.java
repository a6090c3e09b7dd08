package io.sqlbench.eval.runtime.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One benchmark question read from the input file. Immutable once read.
 *
 * @param database base database name, {@code null} when absent
 * @param missingFields required keys absent from the input record
 */
public record BenchmarkInstance(String instanceId,
                                String database,
                                String category,
                                List<String> preprocessSql,
                                List<String> candidateSql,
                                List<String> referenceSql,
                                List<String> cleanupSql,
                                List<PredicateSpec> predicates,
                                Map<String, Object> conditions,
                                boolean efficiency,
                                List<String> missingFields) {

    public static final String QUERY_CATEGORY = "Query";
    public static final String DEFAULT_PREDICATE = "result_equivalence";

    public static final String INSTANCE_ID = "instance_id";
    public static final String SELECTED_DATABASE = "selected_database";
    public static final String PREPROCESS_SQL = "preprocess_sql";
    public static final String SOL_SQL = "sol_sql";
    public static final String PRED_SQLS = "pred_sqls";
    public static final String CLEAN_UP_SQL = "clean_up_sql";
    public static final String TEST_CASES = "test_cases";
    public static final String CONDITIONS = "conditions";
    public static final String CATEGORY = "category";
    public static final String EFFICIENCY = "efficiency";
    public static final String ORDER = "order";

    public static final List<String> REQUIRED_FIELDS = List.of(SELECTED_DATABASE, PREPROCESS_SQL, SOL_SQL, PRED_SQLS);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public BenchmarkInstance {
        preprocessSql = List.copyOf(preprocessSql);
        candidateSql = List.copyOf(candidateSql);
        referenceSql = List.copyOf(referenceSql);
        cleanupSql = List.copyOf(cleanupSql);
        predicates = List.copyOf(predicates);
        conditions = conditions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
        missingFields = List.copyOf(missingFields);
    }

    /**
     * @param position 1-based position in the input, used when the record carries no id
     */
    public static BenchmarkInstance fromJson(ObjectNode node, int position) {
        var missing = new ArrayList<String>();
        for (String field : REQUIRED_FIELDS) {
            if (!node.has(field)) {
                missing.add(field);
            }
        }
        var id = node.hasNonNull(INSTANCE_ID) ? node.get(INSTANCE_ID).asText() : String.valueOf(position);
        var database = node.hasNonNull(SELECTED_DATABASE) ? node.get(SELECTED_DATABASE).asText() : null;
        var category = node.hasNonNull(CATEGORY) ? node.get(CATEGORY).asText() : QUERY_CATEGORY;
        var predicates = new ArrayList<PredicateSpec>();
        var testCases = node.get(TEST_CASES);
        if (testCases != null && testCases.isArray()) {
            testCases.forEach(testCase -> predicates.add(PredicateSpec.fromJson(testCase)));
        }
        Map<String, Object> conditions = Map.of();
        var conditionNode = node.get(CONDITIONS);
        if (conditionNode != null && conditionNode.isObject()) {
            conditions = MAPPER.convertValue(conditionNode, MAPPER.getTypeFactory()
                    .constructMapType(LinkedHashMap.class, String.class, Object.class));
        }
        return new BenchmarkInstance(id,
                database,
                category,
                splitField(node.get(PREPROCESS_SQL)),
                splitField(node.get(PRED_SQLS)),
                splitField(node.get(SOL_SQL)),
                splitField(node.get(CLEAN_UP_SQL)),
                predicates,
                conditions,
                node.path(EFFICIENCY).asBoolean(false),
                missing);
    }

    /**
     * A string is a single statement, an array is a list of statements, anything else is empty.
     */
    public static List<String> splitField(JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isTextual()) {
            return List.of(value.asText());
        }
        if (value.isArray()) {
            var statements = new ArrayList<String>();
            value.forEach(v -> statements.add(v.isTextual() ? v.asText() : v.toString()));
            return statements;
        }
        return List.of();
    }

    public boolean isValid() {
        return missingFields.isEmpty();
    }

    public boolean isQuery() {
        return QUERY_CATEGORY.equals(category);
    }

    public boolean orderMatters() {
        var order = conditions.get(ORDER);
        if (order instanceof Boolean b) {
            return b;
        }
        return order != null && Boolean.parseBoolean(order.toString());
    }

    /**
     * The predicates the instance is judged by. Query instances are always judged by result
     * equivalence under their conditions.
     */
    public List<PredicateSpec> effectivePredicates() {
        if (isQuery()) {
            return List.of(PredicateSpec.of(DEFAULT_PREDICATE));
        }
        return predicates;
    }
}
