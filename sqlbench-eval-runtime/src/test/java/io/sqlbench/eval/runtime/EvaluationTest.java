package io.sqlbench.eval.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlbench.eval.commons.QuerySettings;
import io.sqlbench.eval.commons.admin.DatabaseAdminException;
import io.sqlbench.eval.runtime.model.InstanceOutcome;
import io.sqlbench.eval.runtime.pipeline.InstancePipeline;
import io.sqlbench.eval.runtime.predicate.ThreadPredicateExecutor;
import io.sqlbench.eval.runtime.report.ReportWriter;
import io.sqlbench.eval.runtime.report.StatusWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final QuerySettings SETTINGS = new QuerySettings(60_000, 10_000, false);
    private static final List<String> SHOP = List.of(
            "create table items (id int, name varchar, price decimal(10, 2))",
            "insert into items values (1, 'pen', 1.50), (2, 'book', 12.00), (3, 'bag', 30.25)");

    @TempDir
    Path outputDirectory;

    private static Evaluation evaluation(DuckDBDatabases databases, int threads, Duration acquireTimeout) {
        var options = new EvaluationOptions(threads, threads, acquireTimeout, false, true);
        return new Evaluation(options, databases, databases, SETTINGS,
                new ThreadPredicateExecutor(databases::open, SETTINGS, Duration.ofSeconds(10)));
    }

    private static List<ObjectNode> records(String... lines) throws Exception {
        var records = new ArrayList<ObjectNode>();
        for (String line : lines) {
            records.add((ObjectNode) MAPPER.readTree(line));
        }
        return records;
    }

    @Test
    public void testRunWritesReportAndStatus() throws Exception {
        var databases = new DuckDBDatabases().withTemplate("shop", SHOP);
        var records = records(
                "{\"instance_id\": 10, \"selected_database\": \"shop\", \"preprocess_sql\": [], \"sol_sql\": \"select name from items\", \"pred_sqls\": \"select name from items order by name\"}",
                "{\"instance_id\": 2, \"selected_database\": \"shop\", \"preprocess_sql\": [], \"sol_sql\": \"select name from items\", \"pred_sqls\": \"select nope from items\"}",
                "{\"instance_id\": 1, \"selected_database\": \"shop\", \"preprocess_sql\": [], \"sol_sql\": \"select count(*) from items\", \"pred_sqls\": [\"select count(*) from items where id > 1\"]}",
                "{\"instance_id\": 3, \"preprocess_sql\": [], \"sol_sql\": \"select 1\", \"pred_sqls\": \"select 1\"}");

        try (var evaluation = evaluation(databases, 2, Duration.ofSeconds(30))) {
            var report = evaluation.run(records, outputDirectory);

            assertEquals(4, report.statistics().totalInstances());
            assertEquals(2, report.statistics().executionErrors());
            assertEquals(1, report.statistics().assertionErrors());
            assertEquals(1, report.statistics().passedInstances());
            assertEquals(25.0, report.statistics().overallAccuracy(), 1e-9);
            assertFalse(report.hasFatalErrors());
            assertEquals(List.of("1", "2", "3", "10"),
                    report.outcomes().stream().map(InstanceOutcome::instanceId).toList());
            assertTrue(databases.exists("shop_process_1"));
            assertTrue(databases.exists("shop_process_2"));

            var text = Files.readString(outputDirectory.resolve(ReportWriter.REPORT_FILE), StandardCharsets.UTF_8);
            assertTrue(text.contains("Number of Instances: 4"), text);
            assertTrue(text.contains("Overall Accuracy: 25.00%"), text);
            assertTrue(text.contains("Question_1: (0/1) test cases passed, failed test cases: test_1 | Eval Phase: Assertion Error"), text);
            assertTrue(text.contains("Question_2: (0/1) test cases passed, failed test cases: None | Eval Phase: Execution Error"), text);
            assertTrue(text.contains("Question_10: (1/1) test cases passed, failed test cases: None" + System.lineSeparator()), text);
            assertTrue(text.indexOf("Question_3:") < text.indexOf("Question_10:"), text);

            var status = Files.readAllLines(outputDirectory.resolve(StatusWriter.STATUS_FILE), StandardCharsets.UTF_8);
            assertEquals(4, status.size());
            var first = MAPPER.readTree(status.get(0));
            assertEquals(1, first.get("instance_id").asInt());
            assertEquals("failed", first.get("status").asText());
            assertEquals("test_1 failed", first.get("error_message").asText());
            assertEquals("Eval Phase: Execution Error", MAPPER.readTree(status.get(1)).get("error_message").asText());
            assertEquals("Missing fields: selected_database", MAPPER.readTree(status.get(2)).get("error_message").asText());
            var last = MAPPER.readTree(status.get(3));
            assertEquals("success", last.get("status").asText());
            assertTrue(last.get("error_message").isNull());
        }
        assertFalse(databases.exists("shop_process_1"));
        assertFalse(databases.exists("shop_process_2"));
    }

    @Test
    public void testResetFailureIsFatal() throws Exception {
        var databases = new DuckDBDatabases() {
            private int creates;

            @Override
            public synchronized void createDatabase(String database, String template) {
                if (++creates > 1) {
                    throw new DatabaseAdminException("createdb: disk full");
                }
                super.createDatabase(database, template);
            }
        }.withTemplate("shop", SHOP);
        var records = records(
                "{\"instance_id\": 1, \"selected_database\": \"shop\", \"preprocess_sql\": [], \"sol_sql\": \"select 1\", \"pred_sqls\": \"select 1\"}",
                "{\"instance_id\": 2, \"selected_database\": \"shop\", \"preprocess_sql\": [], \"sol_sql\": \"select 1\", \"pred_sqls\": \"select 1\"}");

        try (var evaluation = evaluation(databases, 1, Duration.ofMillis(300))) {
            var report = evaluation.run(records, outputDirectory);

            assertTrue(report.hasFatalErrors());
            assertEquals(List.of("Instance 1: createdb: disk full"), report.fatalErrors());
            assertEquals(2, report.statistics().executionErrors());
            assertEquals("Database reset failed: createdb: disk full", report.outcomes().get(0).errorMessage());
            assertEquals(InstancePipeline.NO_DATABASE_MESSAGE, report.outcomes().get(1).errorMessage());

            var text = Files.readString(outputDirectory.resolve(ReportWriter.REPORT_FILE), StandardCharsets.UTF_8);
            assertTrue(text.contains("Fatal Database Administration Errors:"), text);
        }
    }

    @Test
    public void testProvisioningFailurePropagates() throws Exception {
        var databases = new DuckDBDatabases().withTemplate("shop", SHOP);
        databases.failCreate(true);
        var records = records(
                "{\"instance_id\": 1, \"selected_database\": \"shop\", \"preprocess_sql\": [], \"sol_sql\": \"select 1\", \"pred_sqls\": \"select 1\"}");
        try (var evaluation = evaluation(databases, 1, Duration.ofMillis(300))) {
            assertThrows(DatabaseAdminException.class, () -> evaluation.run(records, outputDirectory));
        }
        assertFalse(Files.exists(outputDirectory.resolve(ReportWriter.REPORT_FILE)));
    }
}
