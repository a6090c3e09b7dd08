package io.sqlbench.eval.runtime.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads newline-delimited JSON records. Blank lines are skipped.
 */
public final class InstanceReader {
    private static final Logger logger = LoggerFactory.getLogger(InstanceReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private InstanceReader() {
    }

    public static List<ObjectNode> read(Path path) throws IOException {
        var records = new ArrayList<ObjectNode>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            var node = MAPPER.readTree(line);
            if (!(node instanceof ObjectNode object)) {
                throw new IOException("Line %d of %s is not a JSON object".formatted(lineNumber, path));
            }
            records.add(object);
        }
        logger.info("Read {} record(s) from {}", records.size(), path);
        return records;
    }

    public static List<BenchmarkInstance> parse(List<ObjectNode> records) {
        var instances = new ArrayList<BenchmarkInstance>(records.size());
        for (int i = 0; i < records.size(); i++) {
            instances.add(BenchmarkInstance.fromJson(records.get(i), i + 1));
        }
        return instances;
    }
}
