package io.sqlbench.eval.runtime.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sqlbench.eval.runtime.model.InstanceOutcome;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes every input record back with its {@code status} and {@code error_message}.
 */
public final class StatusWriter {

    public static final String STATUS_FILE = "output_with_status.jsonl";
    public static final String STATUS = "status";
    public static final String ERROR_MESSAGE = "error_message";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StatusWriter() {
    }

    public static Path write(RunReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        var path = directory.resolve(STATUS_FILE);
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (RunReport.Entry entry : report.entries()) {
                var record = entry.record().deepCopy();
                record.put(STATUS, entry.outcome().status());
                record.put(ERROR_MESSAGE, errorMessage(entry.outcome()));
                writer.write(MAPPER.writeValueAsString(record));
                writer.newLine();
            }
        }
        return path;
    }

    /**
     * Failed predicate ids when there are any, else the pipeline message, else the phase note.
     */
    public static String errorMessage(InstanceOutcome outcome) {
        if (outcome.isSuccess()) {
            return null;
        }
        if (!outcome.failedPredicates().isEmpty()) {
            return String.join(", ", outcome.failedPredicates()) + " failed";
        }
        if (outcome.errorMessage() != null) {
            return outcome.errorMessage();
        }
        return ReportWriter.phaseNote(outcome).replaceFirst("^ \\| ", "");
    }
}
