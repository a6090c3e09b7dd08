package io.sqlbench.eval.runtime;

import com.beust.jcommander.ParameterException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CommandLineTest {

    @Test
    public void testParse() {
        var arguments = CommandLine.parse(new String[]{
                "--input", "/data/run/test.jsonl",
                "--limit", "5",
                "--threads", "8",
                "--conf", "sqlbench.predicate.isolation = thread",
                "--conf", "sqlbench.database.port = 6543"});
        assertEquals(Path.of("/data/run/test.jsonl"), arguments.input());
        assertEquals(5, arguments.limit());
        assertEquals(8, arguments.config().getInt("sqlbench.threads"));
        assertEquals("thread", arguments.config().getString("sqlbench.predicate.isolation"));
        assertEquals(6543, arguments.config().getInt("sqlbench.database.port"));
        assertEquals(Path.of("/data/run/test"), arguments.experimentDirectory());
    }

    @Test
    public void testOutputDirectory() {
        var arguments = CommandLine.parse(new String[]{"--input", "in/data.v1.jsonl", "--output-dir", "/tmp/out"});
        assertNull(arguments.limit());
        assertFalse(arguments.config().hasPath("sqlbench.threads"));
        assertEquals(Path.of("/tmp/out/data.v1"), arguments.experimentDirectory());
    }

    @Test
    public void testMissingInput() {
        assertThrows(ParameterException.class, () -> CommandLine.parse(new String[]{"--threads", "2"}));
    }
}
