package io.sqlbench.eval.runtime.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlbench.eval.runtime.model.InstanceOutcome;
import io.sqlbench.eval.runtime.pipeline.RunStatistics;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ReportWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static InstanceOutcome outcome(String id, boolean execution, boolean timeout, boolean assertion,
                                           int passed, int total, List<String> failed, String message) {
        return InstanceOutcome.of(id, execution, timeout, assertion, passed, total, failed, message, false);
    }

    private static ObjectNode record(String id) {
        return MAPPER.createObjectNode().put("instance_id", id);
    }

    @Test
    public void testLine() {
        assertEquals("Question_3: (2/2) test cases passed, failed test cases: None",
                ReportWriter.line(outcome("3", false, false, false, 2, 2, List.of(), null)));
        assertEquals("Question_4: (1/3) test cases passed, failed test cases: test_2, test_3 | Eval Phase: Assertion Error",
                ReportWriter.line(outcome("4", false, false, true, 1, 3, List.of("test_2", "test_3"), null)));
        assertEquals("Question_5: (0/1) test cases passed, failed test cases: None | Eval Phase: Execution Error | Eval Phase: Timeout Error",
                ReportWriter.line(outcome("5", true, true, false, 0, 1, List.of(), null)));
    }

    @Test
    public void testErrorMessage() {
        assertNull(StatusWriter.errorMessage(outcome("1", false, false, false, 1, 1, List.of(), null)));
        assertEquals("test_1, test_3 failed",
                StatusWriter.errorMessage(outcome("1", false, false, true, 1, 3, List.of("test_1", "test_3"), "ignored")));
        assertEquals("No available ephemeral databases.",
                StatusWriter.errorMessage(outcome("1", true, false, false, 0, 1, List.of(), "No available ephemeral databases.")));
        assertEquals("Eval Phase: Timeout Error",
                StatusWriter.errorMessage(outcome("1", false, true, false, 0, 1, List.of(), null)));
    }

    @Test
    public void testRenderSortsByInstanceId() {
        var statistics = new RunStatistics();
        var outcomes = new ArrayList<InstanceOutcome>();
        var records = new ArrayList<ObjectNode>();
        for (String id : List.of("10", "x", "2")) {
            var outcome = outcome(id, false, false, false, 1, 1, List.of(), null);
            statistics.record(outcome);
            outcomes.add(outcome);
            records.add(record(id));
        }
        var phases = new LinkedHashMap<String, Double>();
        phases.put("acquire", 1.25);
        phases.put("candidate", 10.0);
        var report = RunReport.of(statistics.snapshot(), outcomes, records,
                LocalDateTime.of(2024, 5, 1, 12, 30, 15, 123456000), phases, List.of());

        assertEquals(List.of("2", "10", "x"), report.entries().stream().map(e -> e.record().get("instance_id").asText()).toList());
        var text = ReportWriter.render(report);
        assertTrue(text.contains("SQL Benchmark Evaluation Statistics (Postgres, Multi-Thread):"), text);
        assertTrue(text.contains("Total Errors: 0"), text);
        assertTrue(text.contains("Overall Accuracy: 100.00%"), text);
        assertTrue(text.contains("Timestamp: 2024-05-01 12:30:15.123456"), text);
        assertTrue(text.contains("  acquire: 1.3") || text.contains("  acquire: 1.2"), text);
        assertTrue(text.contains("  candidate: 10.0"), text);
        assertTrue(text.indexOf("Question_2:") < text.indexOf("Question_10:"), text);
        assertTrue(text.indexOf("Question_10:") < text.indexOf("Question_x:"), text);
        assertFalse(text.contains("Fatal"), text);
    }

    @Test
    public void testMismatchedRecordsAreRejected() {
        var outcomes = List.of(outcome("1", false, false, false, 1, 1, List.of(), null));
        assertThrows(IllegalStateException.class, () -> RunReport.of(new RunStatistics().snapshot(), outcomes,
                List.of(), LocalDateTime.now(), Map.of(), List.of()));
    }
}
