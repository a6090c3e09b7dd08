package io.sqlbench.eval.runtime.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InstanceReaderTest {

    @TempDir
    Path directory;

    @Test
    public void testReadSkipsBlankLines() throws Exception {
        var input = directory.resolve("input.jsonl");
        Files.writeString(input, """
                {"instance_id": 1, "selected_database": "a"}

                {"selected_database": "b"}
                """);
        var records = InstanceReader.read(input);
        assertEquals(2, records.size());
        var instances = InstanceReader.parse(records);
        assertEquals("1", instances.get(0).instanceId());
        assertEquals("2", instances.get(1).instanceId());
        assertEquals("b", instances.get(1).database());
    }

    @Test
    public void testNonObjectLineIsRejected() throws Exception {
        var input = directory.resolve("input.jsonl");
        Files.writeString(input, "[1, 2]\n");
        var e = assertThrows(IOException.class, () -> InstanceReader.read(input));
        assertTrue(e.getMessage().startsWith("Line 1 of "));
    }

    @Test
    public void testInstanceIdOrder() {
        var ids = new ArrayList<>(List.of("b", "10", "2", "a", "1"));
        ids.sort(InstanceIds.ORDER);
        assertEquals(List.of("1", "2", "10", "a", "b"), ids);
    }
}
