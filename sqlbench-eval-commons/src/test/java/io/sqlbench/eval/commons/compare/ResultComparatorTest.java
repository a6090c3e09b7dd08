package io.sqlbench.eval.commons.compare;

import io.sqlbench.eval.commons.DuckDBConnectionPool;
import io.sqlbench.eval.commons.QueryExecutor;
import io.sqlbench.eval.commons.QuerySettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResultComparatorTest {

    private DuckDBConnectionPool pool;
    private QueryExecutor executor;
    private ResultComparator comparator;
    private Connection connection;

    @BeforeEach
    public void setUp() {
        pool = new DuckDBConnectionPool();
        executor = new QueryExecutor(pool, new QuerySettings(60_000, 10_000, false));
        comparator = new ResultComparator(executor);
        connection = executor.phaseConnection("db");
        executor.executeAll(List.of(
                "create table items (id int, price decimal(10, 3))",
                "insert into items values (1, 10.004), (2, 20.5), (3, 30)"), "db", connection, "setup");
    }

    @AfterEach
    public void tearDown() {
        executor.release("db", connection);
        pool.close();
    }

    @Test
    public void testRowOrderIgnoredByDefault() {
        assertTrue(comparator.compareResults(
                List.of("select id, price from items order by id desc"),
                List.of("select id, price from items order by id"),
                "db", connection, false));
    }

    @Test
    public void testRowOrderEnforcedWhenRequested() {
        assertFalse(comparator.compareResults(
                List.of("select id from items order by id desc"),
                List.of("select id from items order by id"),
                "db", connection, true));
        assertTrue(comparator.compareResults(
                List.of("select id from items order by id"),
                List.of("select id from items order by id"),
                "db", connection, true));
    }

    @Test
    public void testValuesCompareAfterRounding() {
        assertTrue(comparator.compareResults(
                List.of("select id, price from items where id = 1"),
                List.of("select id, 10.00 from items where id = 1"),
                "db", connection, false));
    }

    @Test
    public void testErrorIsMismatch() {
        assertFalse(comparator.compareResults(
                List.of("select * from missing"),
                List.of("select id from items"),
                "db", connection, false));
        assertFalse(comparator.compareResults(
                List.of("select id from items"),
                List.of("select * from missing"),
                "db", connection, false));
    }

    @Test
    public void testEmptyResultIsMismatch() {
        assertFalse(comparator.compareResults(
                List.of("select id from items where id > 100"),
                List.of("select id from items where id > 100"),
                "db", connection, false));
    }

    @Test
    public void testLastStatementIsCompared() {
        assertTrue(comparator.compareResults(
                List.of("create temp table tmp as select id from items", "select id from tmp"),
                List.of("select id from items"),
                "db", connection, false));
    }

    /**
     * Unordered comparison treats results as sets, so duplicates collapse.
     */
    @Test
    public void testUnorderedComparisonCollapsesDuplicates() {
        assertTrue(comparator.compareResults(
                List.of("select id from items union all select id from items"),
                List.of("select id from items"),
                "db", connection, false));
        assertFalse(comparator.compareResults(
                List.of("select id from items union all select id from items"),
                List.of("select id from items"),
                "db", connection, true));
    }

    @Test
    public void testMatches() {
        List<List<Object>> a = List.of(List.of(1), List.of(2));
        List<List<Object>> b = List.of(List.of(2), List.of(1));
        assertTrue(ResultComparator.matches(a, b, false));
        assertFalse(ResultComparator.matches(a, b, true));
    }
}
