package io.sqlbench.eval.commons;

import io.sqlbench.eval.commons.admin.JdbcDatabaseAdmin;
import io.sqlbench.eval.commons.compare.PlanCostComparator;
import io.sqlbench.eval.commons.compare.ResultComparator;
import io.sqlbench.eval.commons.pool.EphemeralDatabasePool;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
public class PostgresIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static DatabaseConfig config;
    private static HikariConnectionPool connectionPool;
    private static EphemeralDatabasePool pool;
    private static QueryExecutor executor;

    @BeforeAll
    public static void setUp() throws SQLException {
        config = new DatabaseConfig(POSTGRES.getHost(), POSTGRES.getFirstMappedPort(),
                POSTGRES.getUsername(), POSTGRES.getPassword(), 1, 2, POSTGRES.getDatabaseName());
        var admin = new JdbcDatabaseAdmin(config);
        admin.createDatabase("shop_template", "template0");
        try (var connection = DriverManager.getConnection(config.jdbcUrl("shop_template"), config.user(), config.password());
             var statement = connection.createStatement()) {
            statement.execute("create table items (id int primary key, name text, price numeric(10, 2))");
            statement.execute("insert into items select g, 'item ' || g, g * 1.5 from generate_series(1, 5000) g");
            statement.execute("analyze items");
        }
        connectionPool = new HikariConnectionPool(config);
        pool = new EphemeralDatabasePool(admin, connectionPool, Duration.ofSeconds(30));
        pool.provision(List.of("shop"), 1);
        executor = new QueryExecutor(connectionPool, QuerySettings.defaults());
    }

    @AfterAll
    public static void tearDown() {
        if (pool != null) {
            pool.close();
        }
        if (connectionPool != null) {
            connectionPool.close();
        }
    }

    @Test
    public void testResetRestoresTemplate() {
        var database = pool.acquire("shop");
        var connection = executor.phaseConnection(database.name());
        var result = executor.executeAll(List.of("insert into items values (0, 'leftover', 1)"),
                database.name(), connection, "write");
        assertFalse(result.failed(), result.errorMessage());
        executor.release(database.name(), connection);
        pool.reset(database);
        pool.release(database);

        var again = pool.acquire("shop");
        assertEquals(database, again);
        var fresh = executor.phaseConnection(again.name());
        try {
            var rows = executor.execute("select count(*) from items where id = 0", again.name(), fresh).rows();
            assertEquals(0L, ((Number) rows.get(0).get(0)).longValue());
        } finally {
            executor.release(again.name(), fresh);
            pool.reset(again);
            pool.release(again);
        }
    }

    @Test
    public void testStatementTimeout() {
        var shortTimeout = new QueryExecutor(connectionPool, new QuerySettings(100, 10, true));
        var database = pool.acquire("shop");
        var connection = shortTimeout.phaseConnection(database.name());
        try {
            assertThrows(StatementTimeoutException.class,
                    () -> shortTimeout.execute("select pg_sleep(2)", database.name(), connection));
            var result = shortTimeout.executeAll(List.of("select pg_sleep(2)"), database.name(), connection, "slow");
            assertTrue(result.timeoutError());
            assertFalse(result.executionError());
        } finally {
            shortTimeout.release(database.name(), connection);
            pool.reset(database);
            pool.release(database);
        }
    }

    @Test
    public void testIndexedLookupIsCheaper() {
        var database = pool.acquire("shop");
        var connection = executor.phaseConnection(database.name());
        try {
            var comparator = new PlanCostComparator(QuerySettings.defaults());
            assertTrue(comparator.compareCost(
                    List.of("select * from items where name = 'item 42'"),
                    List.of("select * from items where id = 42"),
                    connection));
            assertFalse(comparator.compareCost(
                    List.of("select * from items where id = 42"),
                    List.of("select * from items where name = 'item 42'"),
                    connection));
        } finally {
            executor.release(database.name(), connection);
            pool.reset(database);
            pool.release(database);
        }
    }

    @Test
    public void testCostComparisonLeavesNoSideEffects() {
        var database = pool.acquire("shop");
        var connection = executor.phaseConnection(database.name());
        try {
            var comparator = new PlanCostComparator(QuerySettings.defaults());
            comparator.compareCost(
                    List.of("create index items_name on items (name)", "select * from items where name = 'x'", "select * from missing"),
                    List.of("delete from items", "select * from items"),
                    connection);
            var rows = executor.execute("select count(*) from items", database.name(), connection).rows();
            assertEquals(5000L, ((Number) rows.get(0).get(0)).longValue());
            var indexes = executor.execute("select count(*) from pg_indexes where indexname = 'items_name'",
                    database.name(), connection).rows();
            assertEquals(0L, ((Number) indexes.get(0).get(0)).longValue());
        } finally {
            executor.release(database.name(), connection);
            pool.reset(database);
            pool.release(database);
        }
    }

    @Test
    public void testResultComparisonOnClone() {
        var database = pool.acquire("shop");
        var connection = executor.phaseConnection(database.name());
        try {
            var comparator = new ResultComparator(executor);
            assertTrue(comparator.compareResults(
                    List.of("select round(avg(price), 3) from items"),
                    List.of("select avg(price) from items"),
                    database.name(), connection, false));
        } finally {
            executor.release(database.name(), connection);
            pool.reset(database);
            pool.release(database);
        }
    }
}
