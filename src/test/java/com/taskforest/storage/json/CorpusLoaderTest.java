package com.taskforest.storage.json;

import com.taskforest.core.model.TaskRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorpusLoaderTest {

    @TempDir
    Path tempDir;

    private final CorpusLoader loader = new CorpusLoader();

    @Test
    @DisplayName("loads a JSON array of flat records")
    void jsonFile() throws Exception {
        Path file = tempDir.resolve("corpus.json");
        Files.writeString(file, """
                [
                  {"taskId": "P", "createdAt": "2025-01-01T00:00:00Z", "workspace": "/ws",
                   "instruction": "Plan", "childInstructions": ["Write code", 42]},
                  {"id": "C", "createdAt": 1735689660000, "instruction": "Write code", "parentTaskId": "P"}
                ]
                """);

        List<TaskRecord> records = loader.load(file);

        assertEquals(2, records.size());
        TaskRecord p = records.get(0);
        assertEquals("P", p.id());
        assertEquals("/ws", p.workspace());
        assertEquals(List.of("Write code"), p.declaredChildInstructions());
        TaskRecord c = records.get(1);
        assertEquals("C", c.id());
        assertEquals("1735689660000", c.createdAt());
        assertEquals("P", c.declaredParentId());
        assertTrue(c.declaredChildInstructions().isEmpty());
    }

    @Test
    @DisplayName("loads a directory of transcripts, skipping folders without one")
    void transcriptDirectory() throws Exception {
        Path a = Files.createDirectories(tempDir.resolve("task-a"));
        Files.writeString(a.resolve("ui_messages.json"), """
                [{"ts": 1700000000000, "type": "say", "say": "text", "text": "Plan the work"}]
                """);
        Files.writeString(a.resolve("task_metadata.json"), """
                {"workspace": "/repo"}
                """);
        Path b = Files.createDirectories(tempDir.resolve("task-b"));
        Files.writeString(b.resolve("ui_messages.json"), "[]");
        Files.createDirectories(tempDir.resolve("not-a-task"));

        List<TaskRecord> records = loader.load(tempDir);

        assertEquals(2, records.size());
        assertEquals("task-a", records.get(0).id());
        assertEquals("/repo", records.get(0).workspace());
        assertEquals("Plan the work", records.get(0).ownInstruction());
        assertEquals("task-b", records.get(1).id());
    }

    @Test
    @DisplayName("a missing path fails to load")
    void missing() {
        assertThrows(CorpusLoadException.class, () -> loader.load(tempDir.resolve("nope.json")));
    }

    @Test
    @DisplayName("invalid JSON fails to load")
    void invalidJson() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "[{\"taskId\": ");
        var e = assertThrows(CorpusLoadException.class, () -> loader.load(file));
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("a JSON object instead of an array fails to load")
    void notAnArray() throws Exception {
        Path file = tempDir.resolve("object.json");
        Files.writeString(file, "{\"taskId\": \"P\"}");
        assertThrows(CorpusLoadException.class, () -> loader.load(file));
    }
}
