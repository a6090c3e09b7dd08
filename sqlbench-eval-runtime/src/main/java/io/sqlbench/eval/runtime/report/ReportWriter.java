package io.sqlbench.eval.runtime.report;

import io.sqlbench.eval.runtime.model.InstanceOutcome;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Writes the human readable {@code report.txt}.
 */
public final class ReportWriter {

    public static final String REPORT_FILE = "report.txt";
    private static final String RULE = "--------------------------------------------------";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private ReportWriter() {
    }

    public static Path write(RunReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        var path = directory.resolve(REPORT_FILE);
        Files.writeString(path, render(report), StandardCharsets.UTF_8);
        return path;
    }

    public static String render(RunReport report) {
        var text = new StringWriter();
        var out = new PrintWriter(text);
        var stats = report.statistics();
        out.println(RULE);
        out.println("SQL Benchmark Evaluation Statistics (Postgres, Multi-Thread):");
        out.println("Number of Instances: " + stats.totalInstances());
        out.println("Number of Execution Errors: " + stats.executionErrors());
        out.println("Number of Timeouts: " + stats.timeouts());
        out.println("Number of Assertion Errors: " + stats.assertionErrors());
        out.println("Total Errors: " + stats.totalErrors());
        out.println("Overall Accuracy: " + String.format(Locale.ROOT, "%.2f%%", stats.overallAccuracy()));
        out.println("Timestamp: " + TIMESTAMP.format(report.timestamp()));
        out.println();

        for (RunReport.Entry entry : report.entries()) {
            out.println(line(entry.outcome()));
        }

        if (!report.phaseMeanMillis().isEmpty()) {
            out.println();
            out.println("Mean Phase Timings (ms):");
            report.phaseMeanMillis().forEach((phase, mean) ->
                    out.println("  " + phase + ": " + String.format(Locale.ROOT, "%.1f", mean)));
        }
        if (report.hasFatalErrors()) {
            out.println();
            out.println("Fatal Database Administration Errors:");
            report.fatalErrors().forEach(e -> out.println("  " + e));
        }
        out.flush();
        return text.toString();
    }

    public static String line(InstanceOutcome outcome) {
        return "Question_%s: (%d/%d) test cases passed, failed test cases: %s%s".formatted(
                outcome.instanceId(),
                outcome.passedPredicates(),
                outcome.totalPredicates(),
                failedList(outcome),
                phaseNote(outcome));
    }

    public static String failedList(InstanceOutcome outcome) {
        return outcome.failedPredicates().isEmpty() ? "None" : String.join(", ", outcome.failedPredicates());
    }

    public static String phaseNote(InstanceOutcome outcome) {
        var note = new StringBuilder();
        if (outcome.executionError()) {
            note.append(" | Eval Phase: Execution Error");
        }
        if (outcome.timeoutError()) {
            note.append(" | Eval Phase: Timeout Error");
        }
        if (outcome.assertionError()) {
            note.append(" | Eval Phase: Assertion Error");
        }
        return note.toString();
    }
}
