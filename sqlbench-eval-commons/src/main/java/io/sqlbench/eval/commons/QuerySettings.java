package io.sqlbench.eval.commons;

import com.typesafe.config.Config;

import static io.sqlbench.eval.commons.config.ConfigConstants.*;

/**
 * @param statementTimeoutMs server-side timeout applied before every statement
 * @param maxRows rows fetched per statement, the rest is silently dropped
 * @param sessionTimeoutEnabled false for engines that do not understand {@code statement_timeout}
 */
public record QuerySettings(long statementTimeoutMs, int maxRows, boolean sessionTimeoutEnabled) {

    public static final long DEFAULT_STATEMENT_TIMEOUT_MS = 60_000;
    public static final int DEFAULT_MAX_ROWS = 10_000;

    public static QuerySettings defaults() {
        return new QuerySettings(DEFAULT_STATEMENT_TIMEOUT_MS, DEFAULT_MAX_ROWS, true);
    }

    public static QuerySettings fromConfig(Config config) {
        var query = config.getConfig(QUERY_PREFIX);
        return new QuerySettings(query.getLong(STATEMENT_TIMEOUT_MS_KEY),
                query.getInt(MAX_ROWS_KEY),
                query.getBoolean(SESSION_TIMEOUT_ENABLED_KEY));
    }

    public String statementTimeoutSql() {
        return "SET statement_timeout = '%dms'".formatted(statementTimeoutMs);
    }

    public String localStatementTimeoutSql() {
        return "SET LOCAL statement_timeout = '%dms'".formatted(statementTimeoutMs);
    }
}
