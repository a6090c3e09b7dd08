package io.sqlbench.eval.commons.compare;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sqlbench.eval.commons.QuerySettings;
import io.sqlbench.eval.commons.RuntimeSqlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Compares the planner's estimated total cost of two statement lists. Side effects of either list
 * never survive the comparison.
 */
public class PlanCostComparator {
    private static final Logger logger = LoggerFactory.getLogger(PlanCostComparator.class);

    private static final Pattern MEASURED = Pattern.compile("^\\s*(SELECT|INSERT|UPDATE|DELETE)\\b", Pattern.CASE_INSENSITIVE);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final QuerySettings settings;

    public PlanCostComparator(QuerySettings settings) {
        this.settings = settings;
    }

    /**
     * @return true iff the new statements are estimated strictly cheaper than the old ones
     */
    public boolean compareCost(List<String> oldStatements, List<String> newStatements, Connection connection) {
        if (oldStatements == null || newStatements == null || oldStatements.isEmpty() || newStatements.isEmpty()) {
            return false;
        }
        double oldCost = totalCost(oldStatements, connection);
        double newCost = totalCost(newStatements, connection);
        logger.info("Estimated cost old={} new={}", oldCost, newCost);
        return newCost < oldCost;
    }

    public static boolean isMeasured(String sql) {
        return MEASURED.matcher(sql).find();
    }

    /**
     * Sum of the top-level {@code Total Cost} of every measured statement. The transaction is always
     * rolled back, and a failing statement only loses its own savepoint.
     */
    public double totalCost(List<String> statements, Connection connection) {
        try {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                if (settings.sessionTimeoutEnabled()) {
                    statement.execute(settings.localStatementTimeoutSql());
                }
                double total = 0;
                for (String sql : statements) {
                    total += measure(statement, connection, sql);
                }
                return total;
            } finally {
                connection.rollback();
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new RuntimeSqlException("Error estimating plan cost", e);
        }
    }

    private double measure(Statement statement, Connection connection, String sql) throws SQLException {
        Savepoint savepoint = connection.setSavepoint();
        try {
            double cost = 0;
            if (isMeasured(sql)) {
                try (ResultSet resultSet = statement.executeQuery("EXPLAIN (FORMAT JSON) " + sql)) {
                    if (resultSet.next()) {
                        cost = parseTotalCost(resultSet.getString(1));
                    }
                }
            } else {
                statement.execute(sql);
            }
            connection.releaseSavepoint(savepoint);
            return cost;
        } catch (SQLException e) {
            logger.warn("Statement failed during cost estimation, ignored: {}: {}", sql, e.getMessage());
            connection.rollback(savepoint);
            return 0;
        }
    }

    /**
     * Reads {@code [0].Plan."Total Cost"} from {@code EXPLAIN (FORMAT JSON)} output, 0 for any other shape.
     */
    public static double parseTotalCost(String explainJson) {
        if (explainJson == null) {
            return 0;
        }
        try {
            JsonNode root = MAPPER.readTree(explainJson);
            JsonNode plan = root.isArray() && !root.isEmpty() ? root.get(0).path("Plan") : root.path("Plan");
            JsonNode cost = plan.path("Total Cost");
            return cost.isNumber() ? cost.asDouble() : 0;
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable plan: {}", e.getMessage());
            return 0;
        }
    }
}
